package uk.gegc.quizforge.features.runner.domain.event;

import org.springframework.context.ApplicationEvent;

import java.time.Instant;

/**
 * Published when an exercise runner reaches its final state.
 * <p>
 * Lets listeners (pool progress, statistics) react to results without the runner
 * knowing about them. Published synchronously.
 * </p>
 */
public class AttemptCompletedEvent extends ApplicationEvent {

    private final String exerciseId;
    private final String exerciseName;
    private final String userName;
    private final double totalScore;
    private final double maxTotalScore;
    private final Instant submittedAt;

    public AttemptCompletedEvent(Object source, String exerciseId, String exerciseName, String userName,
                                 double totalScore, double maxTotalScore, Instant submittedAt) {
        super(source);
        this.exerciseId = exerciseId;
        this.exerciseName = exerciseName;
        this.userName = userName;
        this.totalScore = totalScore;
        this.maxTotalScore = maxTotalScore;
        this.submittedAt = submittedAt;
    }

    /**
     * Content hash of the exercise, {@code null} when its source is unknown.
     */
    public String getExerciseId() {
        return exerciseId;
    }

    public String getExerciseName() {
        return exerciseName;
    }

    public String getUserName() {
        return userName;
    }

    public double getTotalScore() {
        return totalScore;
    }

    public double getMaxTotalScore() {
        return maxTotalScore;
    }

    public Instant getSubmittedAt() {
        return submittedAt;
    }
}
