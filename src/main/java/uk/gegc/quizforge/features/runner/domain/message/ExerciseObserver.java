package uk.gegc.quizforge.features.runner.domain.message;

@FunctionalInterface
public interface ExerciseObserver {

    void onMessage(ExerciseMessage message);
}
