package uk.gegc.quizforge.features.runner.application;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import uk.gegc.quizforge.features.attempt.application.AttemptResultStore;
import uk.gegc.quizforge.features.exercise.application.ParametrizedExercise;
import uk.gegc.quizforge.features.exercise.domain.model.ExerciseDefinition;
import uk.gegc.quizforge.features.exercise.domain.model.WeightSpec;
import uk.gegc.quizforge.features.model.domain.model.InputField;
import uk.gegc.quizforge.features.runner.domain.event.AttemptCompletedEvent;
import uk.gegc.quizforge.features.runner.domain.message.ChangeWidgetAttribute;
import uk.gegc.quizforge.features.runner.domain.message.CreateWidget;
import uk.gegc.quizforge.features.runner.domain.message.ExerciseAttribute;
import uk.gegc.quizforge.features.runner.domain.message.ExerciseMessage;
import uk.gegc.quizforge.features.runner.domain.message.RenderTemplate;
import uk.gegc.quizforge.features.runner.domain.message.Submit;
import uk.gegc.quizforge.features.runner.domain.message.WaitingForSubmission;
import uk.gegc.quizforge.features.runner.domain.model.AttemptCallback;
import uk.gegc.quizforge.features.runner.domain.model.RunnerState;
import uk.gegc.quizforge.shared.config.QuizForgeProperties;
import uk.gegc.quizforge.shared.exception.InvalidRunnerStateException;
import uk.gegc.quizforge.testsupport.ExerciseFixtures;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ExerciseRunnerTest {

    private static final Instant NOW = Instant.parse("2024-01-01T12:00:00Z");

    @Mock
    private AttemptResultStore store;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private QuizForgeProperties properties;
    private List<ExerciseMessage> messages;

    @BeforeEach
    void setUp() {
        properties = new QuizForgeProperties();
        messages = new ArrayList<>();
    }

    private ExerciseRunner runner(ExerciseDefinition definition, boolean debug, AttemptCallback callback) {
        ExerciseRunner runner = new ExerciseRunner(new ParametrizedExercise(definition), debug, callback,
                properties, clock, store, eventPublisher, objectMapper);
        runner.registerObserver(messages::add);
        return runner;
    }

    @Test
    @DisplayName("run notifies attributes, preamble, widgets and problem, then waits")
    void run_notifiesInOrder() {
        ExerciseRunner runner = runner(ExerciseFixtures.fiveIsTheAnswer(), false, null);

        runner.run();

        assertThat(messages).extracting(ExerciseRunnerTest::describe).containsExactly(
                "attribute:debug",
                "attribute:parameters",
                "attribute:hints",
                "render:preamble",
                "create",
                "change:info",
                "render:problem",
                "waiting");
        assertThat(runner.getState()).isEqualTo(RunnerState.AWAITING_SUBMISSION);
        assertThat(runner.getExercise().getStartedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("debug mode reveals the solutions before waiting")
    void run_debugRevealsSolutions() {
        ExerciseRunner runner = runner(ExerciseFixtures.fiveIsTheAnswer(), true, null);

        runner.run();

        List<String> kinds = messages.stream().map(ExerciseRunnerTest::describe).collect(Collectors.toList());
        assertThat(kinds).containsSubsequence("render:problem", "attribute:the_solution",
                "attribute:a_solution", "waiting");
    }

    @Test
    @DisplayName("widgets are created before their attributes change")
    void run_widgetCreatedBeforeChange() {
        ExerciseRunner runner = runner(ExerciseFixtures.fiveIsTheAnswer(), false, null);

        runner.run();

        CreateWidget create = (CreateWidget) messages.stream()
                .filter(CreateWidget.class::isInstance).findFirst().orElseThrow();
        ChangeWidgetAttribute change = (ChangeWidgetAttribute) messages.stream()
                .filter(ChangeWidgetAttribute.class::isInstance).findFirst().orElseThrow();
        assertThat(messages.indexOf(create)).isLessThan(messages.indexOf(change));
        assertThat(change.widgetId()).isEqualTo(create.widgetId());
        assertThat(create.widgetType()).isEqualTo("Integer");
    }

    @Test
    @DisplayName("submitting scores the answers, reports them and completes the attempt")
    void submit_finishesAttempt() {
        double[] reported = new double[2];
        ExerciseRunner runner = runner(ExerciseFixtures.fiveIsTheAnswer(), false, (total, max) -> {
            reported[0] = total;
            reported[1] = max;
        });
        runner.run();
        messages.clear();

        runner.receive(new Submit("frontend", Map.of("x", 5)));

        assertThat(runner.getState()).isEqualTo(RunnerState.DONE);
        assertThat(reported).containsExactly(10.0, 10.0);
        assertThat(messages).extracting(ExerciseRunnerTest::describe).containsSubsequence(
                "attribute:the_solution",
                "attribute:a_solution",
                "attribute:answers",
                "attribute:max_total_score",
                "attribute:total_score",
                "change:score",
                "change:max_score",
                "change:correct",
                "attribute:correct",
                "render:feedback");
        assertThat(attribute("total_score")).isEqualTo(10.0);
        assertThat(attribute("correct")).isEqualTo(Map.of("x", true));
        assertThat(runner.getExercise().getSubmittedAt()).isEqualTo(NOW);

        ArgumentCaptor<AttemptCompletedEvent> event = ArgumentCaptor.forClass(AttemptCompletedEvent.class);
        verify(eventPublisher).publishEvent(event.capture());
        assertThat(event.getValue().getTotalScore()).isEqualTo(10.0);
        assertThat(event.getValue().getExerciseName()).isEqualTo("FiveIsTheAnswer");
    }

    @Test
    @DisplayName("widget value changes become the answers")
    void receive_valueChangeUpdatesField() {
        ExerciseRunner runner = runner(ExerciseFixtures.fiveIsTheAnswer(), false, null);
        runner.run();
        InputField field = runner.getExercise().widgets().get(0);

        runner.receive(new ChangeWidgetAttribute("frontend", field.getWidgetId(), ChangeWidgetAttribute.VALUE, 5));
        runner.receive(Submit.of("frontend"));

        assertThat(runner.getExercise().answers()).containsEntry("x", 5);
        assertThat(runner.getExercise().totalScore()).isEqualTo(10.0);
    }

    @Test
    @DisplayName("value changes after the submission are ignored")
    void receive_valueChangeAfterSubmit_ignored() {
        ExerciseRunner runner = runner(ExerciseFixtures.fiveIsTheAnswer(), false, null);
        runner.run();
        InputField field = runner.getExercise().widgets().get(0);
        runner.receive(new Submit("frontend", Map.of("x", 5)));

        runner.receive(new ChangeWidgetAttribute("frontend", field.getWidgetId(), ChangeWidgetAttribute.VALUE, 4));

        assertThat(runner.getState()).isEqualTo(RunnerState.DONE);
        assertThat(runner.getExercise().answers()).containsEntry("x", 5);
        assertThat(runner.getExercise().totalScore()).isEqualTo(10.0);
    }

    @Test
    @DisplayName("a submission before run is a state error")
    void submit_beforeRun_rejected() {
        ExerciseRunner runner = runner(ExerciseFixtures.fiveIsTheAnswer(), false, null);

        assertThatThrownBy(() -> runner.receive(Submit.of("frontend")))
                .isInstanceOf(InvalidRunnerStateException.class)
                .satisfies(ex -> assertThat(((InvalidRunnerStateException) ex).getCurrent())
                        .isEqualTo(RunnerState.CREATED));
    }

    @Test
    @DisplayName("a second submission is a state error")
    void submit_twice_rejected() {
        ExerciseRunner runner = runner(ExerciseFixtures.fiveIsTheAnswer(), false, null);
        runner.run();
        runner.receive(Submit.of("frontend"));

        assertThatThrownBy(() -> runner.receive(Submit.of("frontend")))
                .isInstanceOf(InvalidRunnerStateException.class);
        assertThatThrownBy(runner::run).isInstanceOf(InvalidRunnerStateException.class);
    }

    @Test
    @DisplayName("an exercise with source is persisted for its user")
    void persistence_withSource() {
        when(store.ensureUser("John Doe")).thenReturn(42L);
        ExerciseRunner runner = runner(ExerciseFixtures.addition(), false, null);
        String id = runner.getExercise().id();

        verify(store).ensureExercise(eq(id), anyString(), eq("Addition"), eq(1.0));

        runner.run();
        runner.receive(new Submit("frontend", Map.of("sum_", 5)));

        verify(store).appendResult(id, 42L, NOW, NOW, 1.0);
    }

    @Test
    @DisplayName("an exercise without source is not persisted but still completes")
    void persistence_withoutSource() {
        AttemptCallback callback = mock(AttemptCallback.class);
        ExerciseRunner runner = runner(ExerciseFixtures.fiveIsTheAnswer(), false, callback);

        runner.run();
        runner.receive(Submit.of("frontend"));

        verifyNoInteractions(store);
        verify(callback).onCompleted(0.0, 10.0);
    }

    @Test
    @DisplayName("persistence can be switched off")
    void persistence_disabled() {
        properties.getPersistence().setEnabled(false);
        ExerciseRunner runner = runner(ExerciseFixtures.addition(), false, null);

        runner.run();
        runner.receive(Submit.of("frontend"));

        verify(store, never()).ensureUser(anyString());
        verify(store, never()).appendResult(any(), any(), any(), any(), anyDouble());
    }

    @Test
    @DisplayName("total scores are rounded for display")
    void totalScore_rounded() {
        properties.setTotalScoreDecimals(1);
        ExerciseRunner runner = runner(ExerciseFixtures.fiveIsTheAnswer()
                .withWeights(WeightSpec.uniform(1.0 / 3)), false, null);

        runner.run();
        runner.receive(new Submit("frontend", Map.of("x", 5)));

        assertThat(attribute("max_total_score")).isEqualTo(3.3);
    }

    private Object attribute(String name) {
        return messages.stream()
                .filter(ExerciseAttribute.class::isInstance)
                .map(ExerciseAttribute.class::cast)
                .filter(attribute -> attribute.attributeName().equals(name))
                .reduce((first, second) -> second)
                .orElseThrow()
                .attributeValue();
    }

    private static String describe(ExerciseMessage message) {
        if (message instanceof ExerciseAttribute attribute) {
            return "attribute:" + attribute.attributeName();
        }
        if (message instanceof RenderTemplate render) {
            return "render:" + render.templateType();
        }
        if (message instanceof CreateWidget) {
            return "create";
        }
        if (message instanceof ChangeWidgetAttribute change) {
            return "change:" + change.attributeName();
        }
        if (message instanceof WaitingForSubmission) {
            return "waiting";
        }
        return message.getClass().getSimpleName();
    }
}
