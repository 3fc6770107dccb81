package uk.gegc.quizforge.features.runner.application;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;
import uk.gegc.quizforge.features.attempt.application.AttemptResultStore;
import uk.gegc.quizforge.features.exercise.application.ParametrizedExercise;
import uk.gegc.quizforge.features.exercise.domain.model.ExerciseDefinition;
import uk.gegc.quizforge.features.exercise.domain.model.GlobalParameters;
import uk.gegc.quizforge.shared.config.QuizForgeProperties;

import java.time.Clock;
import java.util.Random;

/**
 * Creates runners wired with the configured defaults and collaborators.
 */
@Component
@RequiredArgsConstructor
public class ExerciseRunnerFactory {

    private final QuizForgeProperties properties;
    private final Clock clock;
    private final AttemptResultStore store;
    private final ApplicationEventPublisher eventPublisher;
    private final ObjectMapper objectMapper;

    public ExerciseRunner create(ExerciseDefinition definition) {
        return create(definition, RunOptions.defaults());
    }

    /**
     * @throws uk.gegc.quizforge.shared.exception.ExerciseConfigurationException
     *         if the requested difficulty lies outside [0, 1]
     */
    public ExerciseRunner create(ExerciseDefinition definition, RunOptions options) {
        ParametrizedExercise exercise = new ParametrizedExercise(
                definition,
                globalParameters(options),
                options.difficulty(),
                options.random() != null ? options.random() : new Random());
        return new ExerciseRunner(exercise, options.debug(), options.callback(), properties, clock, store,
                eventPublisher, objectMapper);
    }

    public GlobalParameters globalParameters(RunOptions options) {
        String userName = options.userName() != null ? options.userName() : properties.getUserName();
        return new GlobalParameters(
                properties.getDifficulty().getMin(),
                properties.getDifficulty().getMax(),
                userName,
                options.extras());
    }
}
