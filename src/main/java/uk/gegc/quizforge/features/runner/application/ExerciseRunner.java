package uk.gegc.quizforge.features.runner.application;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import uk.gegc.quizforge.features.attempt.application.AttemptResultStore;
import uk.gegc.quizforge.features.exercise.application.ParametrizedExercise;
import uk.gegc.quizforge.features.model.domain.model.InputField;
import uk.gegc.quizforge.features.runner.domain.event.AttemptCompletedEvent;
import uk.gegc.quizforge.features.runner.domain.message.ChangeWidgetAttribute;
import uk.gegc.quizforge.features.runner.domain.message.CreateWidget;
import uk.gegc.quizforge.features.runner.domain.message.ExerciseAttribute;
import uk.gegc.quizforge.features.runner.domain.message.ExerciseMessage;
import uk.gegc.quizforge.features.runner.domain.message.ExerciseObserver;
import uk.gegc.quizforge.features.runner.domain.message.RenderTemplate;
import uk.gegc.quizforge.features.runner.domain.message.Submit;
import uk.gegc.quizforge.features.runner.domain.message.WaitingForSubmission;
import uk.gegc.quizforge.features.runner.domain.model.AttemptCallback;
import uk.gegc.quizforge.features.runner.domain.model.RunnerState;
import uk.gegc.quizforge.shared.config.QuizForgeProperties;
import uk.gegc.quizforge.shared.exception.InvalidRunnerStateException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Drives one attempt at a {@link ParametrizedExercise}.
 * <p>
 * {@link #run()} renders the exercise to the registered observers and returns once the
 * runner awaits a submission. The attempt resumes when a {@link Submit} message is
 * {@linkplain #receive(ExerciseMessage) received}; finishing scores the answers, reports
 * them to the observers, persists the result and publishes an {@link AttemptCompletedEvent}.
 * </p>
 */
@Slf4j
public class ExerciseRunner {

    public static final String SENDER = "runner";

    private static final Logger HISTORY = LoggerFactory.getLogger("quizforge.history");

    @Getter
    private final ParametrizedExercise exercise;
    private final boolean debug;
    private final AttemptCallback callback;
    private final QuizForgeProperties properties;
    private final Clock clock;
    private final AttemptResultStore store;
    private final ApplicationEventPublisher eventPublisher;
    private final ObjectMapper objectMapper;

    private final List<ExerciseObserver> observers = new CopyOnWriteArrayList<>();
    private final Map<String, InputField> widgetsById = new LinkedHashMap<>();

    @Getter
    private RunnerState state = RunnerState.CREATED;
    private boolean solutionsPublished;
    private Long userId;

    public ExerciseRunner(ParametrizedExercise exercise,
                          boolean debug,
                          AttemptCallback callback,
                          QuizForgeProperties properties,
                          Clock clock,
                          AttemptResultStore store,
                          ApplicationEventPublisher eventPublisher,
                          ObjectMapper objectMapper) {
        this.exercise = exercise;
        this.debug = debug;
        this.callback = callback;
        this.properties = properties;
        this.clock = clock;
        this.store = store;
        this.eventPublisher = eventPublisher;
        this.objectMapper = objectMapper;

        for (InputField field : exercise.widgets()) {
            widgetsById.put(field.getWidgetId(), field);
        }

        if (persistenceActive()) {
            userId = store.ensureUser(exercise.getUserName());
            store.ensureExercise(exercise.id(), exercise.source(), exercise.getDefinition().label(),
                    exercise.maxTotalScore());
        } else {
            log.warn("Results of exercise {} will not be stored", exercise.getName());
        }
    }

    public void registerObserver(ExerciseObserver observer) {
        observers.add(observer);
    }

    /**
     * Renders the exercise and waits for a submission.
     *
     * @throws InvalidRunnerStateException unless the runner was just created
     */
    public synchronized void run() {
        transition(RunnerState.RENDERING);
        log.info("Running exercise {} for {}", exercise.getName(), exercise.getUserName());

        notifyObservers(new ExerciseAttribute(SENDER, "debug", debug));
        notifyObservers(new ExerciseAttribute(SENDER, "parameters", exercise.parameters()));
        notifyObservers(new ExerciseAttribute(SENDER, "hints", exercise.hints()));
        notifyObservers(new RenderTemplate(SENDER, "preamble", exercise.preamble()));
        for (InputField field : exercise.widgets()) {
            notifyObservers(new CreateWidget(SENDER, field.getWidgetId(), field.getValueType().typeName()));
            notifyObservers(new ChangeWidgetAttribute(SENDER, field.getWidgetId(), "info", field.info()));
        }
        notifyObservers(new RenderTemplate(SENDER, "problem", exercise.template()));
        if (debug) {
            publishSolutions();
        }

        exercise.setStartedAt(clock.instant());
        transition(RunnerState.AWAITING_SUBMISSION);
        notifyObservers(new WaitingForSubmission(SENDER));
    }

    /**
     * Handles a message from a frontend: widget value changes update the answers, a
     * submission finishes the attempt. Value changes arriving after the submission and
     * other messages are ignored.
     */
    public synchronized void receive(ExerciseMessage message) {
        if (message instanceof ChangeWidgetAttribute change
                && ChangeWidgetAttribute.VALUE.equals(change.attributeName())) {
            InputField field = widgetsById.get(change.widgetId());
            if (field == null) {
                log.debug("Ignoring value change of unknown widget {}", change.widgetId());
                return;
            }
            if (state == RunnerState.FINISHING || state == RunnerState.DONE) {
                log.debug("Ignoring value change of widget {} after submission", change.widgetId());
                return;
            }
            exercise.setFieldValue(field.getName(), change.attributeValue());
        } else if (message instanceof Submit submit) {
            if (state != RunnerState.AWAITING_SUBMISSION) {
                throw new InvalidRunnerStateException(state, RunnerState.FINISHING);
            }
            if (!submit.answers().isEmpty()) {
                exercise.setAnswers(submit.answers());
            }
            finish();
        }
    }

    /**
     * Scores the current answers and reports the result.
     *
     * @throws InvalidRunnerStateException unless the runner awaits a submission
     */
    public synchronized void finish() {
        transition(RunnerState.FINISHING);
        Instant submittedAt = clock.instant();
        exercise.setSubmittedAt(submittedAt);

        if (!solutionsPublished) {
            publishSolutions();
        }
        notifyObservers(new ExerciseAttribute(SENDER, "answers", exercise.answers()));

        double maxTotalScore = exercise.maxTotalScore();
        double totalScore = exercise.totalScore();
        notifyObservers(new ExerciseAttribute(SENDER, "max_total_score", round(maxTotalScore)));
        notifyObservers(new ExerciseAttribute(SENDER, "total_score", round(totalScore)));

        Map<String, Boolean> correct = exercise.correct();
        Map<String, Double> scores = exercise.scores();
        Map<String, Double> maxScores = exercise.maxScores();
        for (InputField field : exercise.widgets()) {
            field.setDisplayedScore(scores.get(field.getName()));
            field.setDisplayedMaxScore(maxScores.get(field.getName()));
            notifyObservers(new ChangeWidgetAttribute(SENDER, field.getWidgetId(), "score",
                    scores.get(field.getName())));
            notifyObservers(new ChangeWidgetAttribute(SENDER, field.getWidgetId(), "max_score",
                    maxScores.get(field.getName())));
            notifyObservers(new ChangeWidgetAttribute(SENDER, field.getWidgetId(), "correct",
                    correct.get(field.getName())));
        }
        notifyObservers(new ExerciseAttribute(SENDER, "correct", correct));
        notifyObservers(new RenderTemplate(SENDER, "feedback", exercise.feedback()));

        if (persistenceActive()) {
            store.appendResult(exercise.id(), userId, exercise.getStartedAt(), submittedAt, totalScore);
        }
        if (callback != null) {
            callback.onCompleted(totalScore, maxTotalScore);
        }
        if (eventPublisher != null) {
            eventPublisher.publishEvent(new AttemptCompletedEvent(this, exercise.id(), exercise.getName(),
                    exercise.getUserName(), totalScore, maxTotalScore, submittedAt));
        }
        writeHistory();

        transition(RunnerState.DONE);
        log.info("Exercise {} finished with {} of {}", exercise.getName(), totalScore, maxTotalScore);
    }

    private void publishSolutions() {
        notifyObservers(new ExerciseAttribute(SENDER, "the_solution", exercise.theSolution()));
        notifyObservers(new ExerciseAttribute(SENDER, "a_solution", exercise.aSolution()));
        solutionsPublished = true;
    }

    private void writeHistory() {
        try {
            HISTORY.info(objectMapper.writeValueAsString(exercise.summary(properties.getSummaryItems())));
        } catch (JsonProcessingException e) {
            log.error("Could not serialize summary of exercise {}", exercise.getName(), e);
        }
    }

    private boolean persistenceActive() {
        return properties.getPersistence().isEnabled() && store != null && exercise.id() != null;
    }

    private double round(double score) {
        return BigDecimal.valueOf(score)
                .setScale(properties.getTotalScoreDecimals(), RoundingMode.HALF_UP)
                .doubleValue();
    }

    private void notifyObservers(ExerciseMessage message) {
        for (ExerciseObserver observer : new ArrayList<>(observers)) {
            observer.onMessage(message);
        }
    }

    private void transition(RunnerState target) {
        if (!state.canTransitionTo(target)) {
            throw new InvalidRunnerStateException(state, target);
        }
        log.debug("Runner of {} moves from {} to {}", exercise.getName(), state, target);
        state = target;
    }
}
