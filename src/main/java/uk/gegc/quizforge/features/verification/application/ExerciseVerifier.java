package uk.gegc.quizforge.features.verification.application;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.quizforge.features.exercise.application.ParametrizedExercise;
import uk.gegc.quizforge.features.exercise.domain.model.ExerciseDefinition;
import uk.gegc.quizforge.features.exercise.domain.model.GlobalParameters;
import uk.gegc.quizforge.features.scoring.application.ScoreCalculator;
import uk.gegc.quizforge.features.scoring.domain.model.ScoreSheet;
import uk.gegc.quizforge.features.verification.domain.model.CheckResult;
import uk.gegc.quizforge.features.verification.domain.model.VerificationReport;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Self-check for exercise authors. Draws one parameter sample and scores every
 * combination of no answer, trivial input, dummy input and solution.
 */
@Slf4j
@Component
public class ExerciseVerifier {

    public static final String WELL_POSED = "well-posed";
    public static final String SCORES_IN_RANGE = "scores-in-range";
    public static final String SOLUTION_SCORES_MAX = "solution-scores-max";

    private static final double TOLERANCE = 1e-9;

    public VerificationReport verify(ExerciseDefinition definition) {
        return verify(definition, new Random());
    }

    public VerificationReport verify(ExerciseDefinition definition, Random random) {
        ParametrizedExercise exercise =
                new ParametrizedExercise(definition, GlobalParameters.defaults(), null, random);
        List<CheckResult> checks = new ArrayList<>();

        CheckResult wellPosed = checkWellPosed(exercise);
        checks.add(wellPosed);
        if (wellPosed.passed()) {
            checks.add(checkScoresInRange(exercise));
            checks.add(checkSolutionScoresMax(exercise));
        }

        VerificationReport report = new VerificationReport(definition.getName(), checks);
        if (report.passed()) {
            log.info("Exercise {} passed {} checks", definition.getName(), checks.size());
        } else {
            report.failures().forEach(failure ->
                    log.warn("Exercise {} failed {}: {}", definition.getName(), failure.name(), failure.message()));
        }
        return report;
    }

    private CheckResult checkWellPosed(ParametrizedExercise exercise) {
        try {
            exercise.model();
            exercise.solution();
            exercise.hints();
            exercise.maxScores();
            return CheckResult.passed(WELL_POSED);
        } catch (RuntimeException e) {
            return CheckResult.failed(WELL_POSED, e.getMessage());
        }
    }

    private CheckResult checkScoresInRange(ParametrizedExercise exercise) {
        try {
            ScoreCalculator calculator = exercise.scoreCalculator();
            Map<String, Double> maxScores = exercise.maxScores();
            double maxTotal = exercise.maxTotalScore();
            for (Map<String, Object> answers : exercise.inputCombinations()) {
                ScoreSheet sheet = calculator.evaluate(answers);
                for (Map.Entry<String, Double> entry : sheet.perField().entrySet()) {
                    Double score = entry.getValue();
                    Double max = maxScores.get(entry.getKey());
                    if (score == null || max == null) {
                        continue;
                    }
                    if (score < -TOLERANCE || score > max + TOLERANCE) {
                        return CheckResult.failed(SCORES_IN_RANGE, "Score " + score + " of field '"
                                + entry.getKey() + "' is not within [0, " + max + "] for answers " + answers);
                    }
                }
                if (sheet.total() > maxTotal + TOLERANCE) {
                    return CheckResult.failed(SCORES_IN_RANGE, "Total score " + sheet.total()
                            + " exceeds the maximal total score " + maxTotal + " for answers " + answers);
                }
            }
            return CheckResult.passed(SCORES_IN_RANGE);
        } catch (RuntimeException e) {
            return CheckResult.failed(SCORES_IN_RANGE, e.getMessage());
        }
    }

    private CheckResult checkSolutionScoresMax(ParametrizedExercise exercise) {
        try {
            Map<String, Object> solution = exercise.solution();
            ScoreSheet sheet = exercise.scoreCalculator().evaluate(solution);
            Map<String, Double> maxScores = exercise.maxScores();
            for (Map.Entry<String, Double> entry : sheet.perField().entrySet()) {
                String name = entry.getKey();
                Double score = entry.getValue();
                Double max = maxScores.get(name);
                if (solution.get(name) == null || score == null || max == null) {
                    continue;
                }
                if (Math.abs(score - max) > TOLERANCE) {
                    return CheckResult.failed(SOLUTION_SCORES_MAX, "The solution of field '" + name
                            + "' scores " + score + " instead of " + max + ".");
                }
            }
            return CheckResult.passed(SOLUTION_SCORES_MAX);
        } catch (RuntimeException e) {
            return CheckResult.failed(SOLUTION_SCORES_MAX, e.getMessage());
        }
    }
}
