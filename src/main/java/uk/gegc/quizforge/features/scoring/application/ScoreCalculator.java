package uk.gegc.quizforge.features.scoring.application;

import lombok.extern.slf4j.Slf4j;
import uk.gegc.quizforge.features.exercise.domain.hook.FieldScore;
import uk.gegc.quizforge.features.exercise.domain.hook.Hook;
import uk.gegc.quizforge.features.exercise.domain.hook.ScoreResult;
import uk.gegc.quizforge.features.model.domain.model.InputField;
import uk.gegc.quizforge.features.scoring.domain.model.ScoreSheet;
import uk.gegc.quizforge.shared.exception.IllPosedExerciseException;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Interprets the {@code scores} hook of one parametrized exercise.
 * <p>
 * The hook is first called with dummy answers to learn its return shape. Automatic
 * results defer to the value types, joint results score all fields at once and
 * per-field results are combined with automatic scoring for the fields they omit.
 * All scores are multiplied by the normalized field weights.
 * </p>
 */
@Slf4j
public class ScoreCalculator {

    private final Hook<ScoreResult> hook;
    private final Map<String, Object> parameters;
    private final Map<String, InputField> fields;
    private final Map<String, Object> solution;
    private final Map<String, Object> dummyInput;
    private final Map<String, Double> weights;

    public ScoreCalculator(Hook<ScoreResult> hook,
                           Map<String, Object> parameters,
                           Map<String, InputField> fields,
                           Map<String, Object> solution,
                           Map<String, Object> dummyInput,
                           Map<String, Double> weights) {
        this.hook = hook;
        this.parameters = parameters;
        this.fields = fields;
        this.solution = solution;
        this.dummyInput = dummyInput;
        this.weights = weights;
    }

    public ScoreSheet maxScores() {
        ScoreResult shape = invoke(dummyInput);

        if (shape instanceof ScoreResult.Automatic) {
            Map<String, Double> max = new LinkedHashMap<>();
            fields.forEach((name, field) -> max.put(name, field.autoMaxScore() * weights.get(name)));
            return new ScoreSheet(max, sum(max));
        }

        if (shape instanceof ScoreResult.Joint joint) {
            double jointMax;
            if (joint.maxScore() != null) {
                jointMax = joint.maxScore();
            } else {
                for (String name : fields.keySet()) {
                    if (!solution.containsKey(name)) {
                        throw new IllPosedExerciseException("Unable to determine a maximal total score because "
                                + "there is no solution for input field '" + name + "'.");
                    }
                }
                jointMax = requireJoint(invoke(solution)).score();
            }
            return jointSheet(jointMax * ScoreWeights.uniform(weights));
        }

        Map<String, Object> answer = new LinkedHashMap<>();
        fields.keySet().forEach(name ->
                answer.put(name, solution.containsKey(name) ? solution.get(name) : dummyInput.get(name)));
        ScoreResult.PerField atSolution = requirePerField(invoke(answer));

        Map<String, Double> max = new LinkedHashMap<>();
        fields.forEach((name, field) -> {
            FieldScore score = atSolution.scores().get(name);
            Double value;
            if (score == null) {
                value = null;
            } else if (score.maxScore() != null) {
                value = score.maxScore();
            } else if (!solution.containsKey(name)) {
                // a number earned by a dummy answer says nothing about the maximum
                value = null;
            } else {
                value = score.score();
            }
            if (value == null) {
                value = field.autoMaxScore();
            }
            max.put(name, value * weights.get(name));
        });
        return new ScoreSheet(max, sum(max));
    }

    /**
     * Scores the given answers; {@code null} values count as unanswered.
     */
    public ScoreSheet evaluate(Map<String, ?> answers) {
        Map<String, Object> given = new LinkedHashMap<>();
        answers.forEach((name, value) -> {
            if (value != null && fields.containsKey(name)) {
                given.put(name, value);
            }
        });

        ScoreResult shape = invoke(dummyInput);
        if (shape instanceof ScoreResult.Joint) {
            if (!given.keySet().containsAll(fields.keySet())) {
                log.debug("Joint scoring with unanswered fields {}; total score is 0",
                        unanswered(given));
                return unscored(0.0);
            }
            double score = requireJoint(invoke(given)).score();
            return jointSheet(score * ScoreWeights.uniform(weights));
        }

        Map<String, Object> effective = new LinkedHashMap<>(hook.fieldDefaults(fields.keySet()));
        effective.putAll(given);
        Set<String> filled = new HashSet<>();
        for (String name : fields.keySet()) {
            if (!effective.containsKey(name)) {
                effective.put(name, dummyInput.get(name));
                filled.add(name);
            }
        }

        ScoreResult result = invoke(effective);
        if (result instanceof ScoreResult.Joint) {
            throw new IllPosedExerciseException(
                    "The scores method returned a joint score for answers but not for dummy input.");
        }

        Map<String, Double> scores = new LinkedHashMap<>();
        fields.forEach((name, field) -> {
            Double score = null;
            if (result instanceof ScoreResult.PerField perField && perField.scores().get(name) != null) {
                score = filled.contains(name) ? 0.0 : perField.scores().get(name).score();
            }
            if (score == null) {
                score = field.autoScore(given.get(name));
            }
            scores.put(name, score * weights.get(name));
        });
        return new ScoreSheet(scores, sum(scores));
    }

    /**
     * A field is correct iff its score equals its maximal score; {@code null} when either is unknown.
     */
    public static Map<String, Boolean> correct(ScoreSheet scores, ScoreSheet maxScores) {
        Map<String, Boolean> correct = new LinkedHashMap<>();
        scores.perField().forEach((name, score) -> {
            Double max = maxScores.perField().get(name);
            correct.put(name, score == null || max == null ? null : score.doubleValue() == max.doubleValue());
        });
        return correct;
    }

    private ScoreResult invoke(Map<String, ?> answers) {
        Map<String, Object> bag = new LinkedHashMap<>(parameters);
        bag.putAll(answers);
        ScoreResult result = hook.apply(bag);
        return result != null ? result : ScoreResult.automatic();
    }

    private ScoreSheet jointSheet(double total) {
        if (fields.size() == 1) {
            Map<String, Double> single = new LinkedHashMap<>();
            single.put(fields.keySet().iterator().next(), total);
            return new ScoreSheet(single, total);
        }
        return unscored(total);
    }

    private ScoreSheet unscored(double total) {
        Map<String, Double> none = new LinkedHashMap<>();
        fields.keySet().forEach(name -> none.put(name, null));
        return new ScoreSheet(none, total);
    }

    private Set<String> unanswered(Map<String, Object> given) {
        Set<String> missing = new HashSet<>(fields.keySet());
        missing.removeAll(given.keySet());
        return missing;
    }

    private static ScoreResult.Joint requireJoint(ScoreResult result) {
        if (result instanceof ScoreResult.Joint joint) {
            return joint;
        }
        throw new IllPosedExerciseException(
                "The scores method has to return the same kind of result for every answer, expected a joint score.");
    }

    private static ScoreResult.PerField requirePerField(ScoreResult result) {
        if (result instanceof ScoreResult.PerField perField) {
            return perField;
        }
        throw new IllPosedExerciseException(
                "The scores method has to return the same kind of result for every answer, expected scores per field.");
    }

    private static double sum(Map<String, Double> scores) {
        return scores.values().stream()
                .filter(Objects::nonNull)
                .mapToDouble(Double::doubleValue)
                .sum();
    }
}
