package uk.gegc.quizforge.features.scoring.application;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.parallel.Execution;
import org.junit.jupiter.api.parallel.ExecutionMode;
import uk.gegc.quizforge.features.exercise.application.ParametrizedExercise;
import uk.gegc.quizforge.features.exercise.domain.hook.FieldScore;
import uk.gegc.quizforge.features.exercise.domain.hook.Hook;
import uk.gegc.quizforge.features.exercise.domain.hook.ScoreResult;
import uk.gegc.quizforge.features.exercise.domain.hook.SolutionResult;
import uk.gegc.quizforge.features.exercise.domain.model.ExerciseDefinition;
import uk.gegc.quizforge.features.exercise.domain.model.WeightSpec;
import uk.gegc.quizforge.features.model.domain.model.IntegerType;
import uk.gegc.quizforge.features.model.domain.model.Problem;
import uk.gegc.quizforge.features.scoring.domain.model.ScoreSheet;
import uk.gegc.quizforge.shared.exception.IllPosedExerciseException;
import uk.gegc.quizforge.testsupport.ExerciseFixtures;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Execution(ExecutionMode.CONCURRENT)
class ScoreCalculatorTest {

    @Test
    @DisplayName("automatic scoring of the right answer gives the value type's maximum")
    void automatic_endToEnd() {
        ParametrizedExercise exercise = new ParametrizedExercise(ExerciseFixtures.fiveIsTheAnswer());
        exercise.setAnswers(Map.of("x", 5));

        assertThat(exercise.scores()).containsExactly(Map.entry("x", 10.0));
        assertThat(exercise.maxScores()).containsExactly(Map.entry("x", 10.0));
        assertThat(exercise.correct()).containsExactly(Map.entry("x", true));
        assertThat(exercise.totalScore()).isEqualTo(10.0);
    }

    @Test
    @DisplayName("a wrong or missing answer scores zero")
    void automatic_wrongAnswer() {
        ParametrizedExercise wrong = new ParametrizedExercise(ExerciseFixtures.fiveIsTheAnswer());
        wrong.setAnswers(Map.of("x", 4));
        ParametrizedExercise missing = new ParametrizedExercise(ExerciseFixtures.fiveIsTheAnswer());

        assertThat(wrong.scores()).containsEntry("x", 0.0);
        assertThat(wrong.correct()).containsEntry("x", false);
        assertThat(missing.totalScore()).isZero();
    }

    @Test
    @DisplayName("automatic scoring of an answered field without solution is ill-posed")
    void automatic_withoutSolution_illPosed() {
        ExerciseDefinition definition = ExerciseFixtures.fiveIsTheAnswer().toBuilder()
                .theSolution(Hook.constant(SolutionResult.none()))
                .build();
        ParametrizedExercise exercise = new ParametrizedExercise(definition);
        exercise.setAnswers(Map.of("x", 5));

        assertThatThrownBy(exercise::scores).isInstanceOf(IllPosedExerciseException.class);
    }

    @Test
    @DisplayName("field weights multiply automatic scores")
    void automatic_weighted() {
        ParametrizedExercise exercise = new ParametrizedExercise(
                ExerciseFixtures.fiveIsTheAnswer().withWeights(WeightSpec.uniform(0.5)));
        exercise.setAnswers(Map.of("x", 5));

        assertThat(exercise.maxTotalScore()).isEqualTo(5.0);
        assertThat(exercise.totalScore()).isEqualTo(5.0);
    }

    @Test
    @DisplayName("a joint score with a single unanswered field totals zero")
    void joint_unanswered_totalZero() {
        ExerciseDefinition definition = ExerciseFixtures.fiveIsTheAnswer().toBuilder()
                .scores(Hook.constant(ScoreResult.joint(7.0)))
                .build();
        ParametrizedExercise exercise = new ParametrizedExercise(definition);

        assertThat(exercise.totalScore()).isZero();
        assertThat(exercise.correct()).containsEntry("x", null);
    }

    @Test
    @DisplayName("a joint score is all or nothing across fields")
    void joint_allOrNothing() {
        ParametrizedExercise partial = new ParametrizedExercise(ExerciseFixtures.jointPair());
        partial.setAnswers(Map.of("p", 1));
        ParametrizedExercise complete = new ParametrizedExercise(ExerciseFixtures.jointPair());
        complete.setAnswers(Map.of("p", 1, "q", 2));

        assertThat(partial.totalScore()).isZero();
        assertThat(partial.scores()).containsEntry("p", null).containsEntry("q", null);
        assertThat(complete.totalScore()).isEqualTo(4.0);
        assertThat(complete.maxTotalScore()).isEqualTo(4.0);
        assertThat(complete.correct()).containsEntry("p", null);
    }

    @Test
    @DisplayName("a joint score needs one weight for all fields")
    void joint_nonUniformWeights_illPosed() {
        ParametrizedExercise exercise = new ParametrizedExercise(
                ExerciseFixtures.jointPair().withWeights(WeightSpec.perField(Map.of("p", 2.0))));

        assertThatThrownBy(exercise::maxTotalScore).isInstanceOf(IllPosedExerciseException.class);
    }

    @Test
    @DisplayName("a joint (score, max) pair sets the maximum directly")
    void joint_explicitMax() {
        ExerciseDefinition definition = ExerciseFixtures.fiveIsTheAnswer().toBuilder()
                .scores(Hook.constant(ScoreResult.joint(1.0, 3.0)))
                .build();

        assertThat(new ParametrizedExercise(definition).maxScores()).containsExactly(Map.entry("x", 3.0));
    }

    @Test
    @DisplayName("per-field scores fall back to automatic scoring for omitted fields")
    void perField_fallback() {
        ParametrizedExercise exercise = new ParametrizedExercise(perFieldExercise());
        exercise.setAnswers(Map.of("a", 4, "b", 3));

        assertThat(exercise.maxScores()).containsExactly(Map.entry("a", 2.0), Map.entry("b", 1.0));
        assertThat(exercise.scores()).containsExactly(Map.entry("a", 2.0), Map.entry("b", 1.0));
        assertThat(exercise.correct()).containsExactly(Map.entry("a", true), Map.entry("b", true));
    }

    @Test
    @DisplayName("an unanswered field scores zero under per-field scoring")
    void perField_unansweredFieldZero() {
        ParametrizedExercise exercise = new ParametrizedExercise(perFieldExercise());
        exercise.setAnswers(Map.of("b", 3));

        assertThat(exercise.scores()).containsExactly(Map.entry("a", 0.0), Map.entry("b", 1.0));
    }

    @Test
    @DisplayName("an explicit per-field maximum is used as is")
    void perField_explicitMax() {
        ExerciseDefinition definition = ExerciseFixtures.fiveIsTheAnswer().toBuilder()
                .scores(Hook.constant(ScoreResult.perField(Map.of("x", FieldScore.of(1.0, 5.0)))))
                .build();

        assertThat(new ParametrizedExercise(definition).maxScores()).containsExactly(Map.entry("x", 5.0));
    }

    @Test
    @DisplayName("switching between joint and per-field results is ill-posed")
    void inconsistentShape_illPosed() {
        ExerciseDefinition definition = ExerciseFixtures.fiveIsTheAnswer().toBuilder()
                .scores(Hook.of(args -> args.getLong("x") == 1L
                        ? ScoreResult.perFieldScores(Map.of("x", 0))
                        : ScoreResult.joint(1.0), "x"))
                .build();
        ParametrizedExercise exercise = new ParametrizedExercise(definition);

        assertThatThrownBy(exercise::maxScores).isInstanceOf(IllPosedExerciseException.class);
    }

    @Test
    @DisplayName("correct is null where a score or maximum is unknown")
    void correct_unknownIsNull() {
        Map<String, Double> scores = new LinkedHashMap<>();
        scores.put("a", 1.0);
        scores.put("b", null);
        scores.put("c", 0.5);
        Map<String, Double> max = new HashMap<>();
        max.put("a", 1.0);
        max.put("b", 1.0);
        max.put("c", 1.0);

        Map<String, Boolean> correct = ScoreCalculator.correct(new ScoreSheet(scores, 1.5), new ScoreSheet(max, 3.0));

        assertThat(correct).containsEntry("a", true).containsEntry("b", null).containsEntry("c", false);
    }

    private static ExerciseDefinition perFieldExercise() {
        return ExerciseDefinition.builder()
                .name("PerField")
                .problem(Hook.of(args -> new Problem("<<a>> <<b>>",
                        Map.of("a", new IntegerType(), "b", new IntegerType()))))
                .theSolution(Hook.constant(SolutionResult.perField(Map.of("a", 4, "b", 3))))
                .scores(Hook.of(args -> ScoreResult.perFieldScores(
                        Map.of("a", args.getLong("a") == 4L ? 2.0 : 0.0)), "a"))
                .build();
    }
}
