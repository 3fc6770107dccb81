package uk.gegc.quizforge.features.scoring.application;

import uk.gegc.quizforge.features.exercise.domain.model.WeightSpec;
import uk.gegc.quizforge.shared.exception.ExerciseConfigurationException;
import uk.gegc.quizforge.shared.exception.IllPosedExerciseException;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Normalizes an exercise's weight settings into one weight per input field.
 */
public final class ScoreWeights {

    private ScoreWeights() {
    }

    /**
     * A uniform weight is broadcast to every field, or stored under a single {@code null}
     * key when there are no fields. Per-field weights must only name existing fields;
     * fields without a weight get the default weight of the spec, 1.0 unless it was scaled.
     *
     * @throws ExerciseConfigurationException if a weight names an unknown field
     */
    public static Map<String, Double> normalize(WeightSpec spec, Collection<String> fieldNames) {
        Map<String, Double> weights = new LinkedHashMap<>();
        if (spec instanceof WeightSpec.Uniform uniform) {
            if (fieldNames.isEmpty()) {
                weights.put(null, uniform.weight());
            } else {
                fieldNames.forEach(name -> weights.put(name, uniform.weight()));
            }
            return Collections.unmodifiableMap(weights);
        }
        WeightSpec.PerField perField = (WeightSpec.PerField) spec;
        for (String key : perField.weights().keySet()) {
            if (!fieldNames.contains(key)) {
                throw new ExerciseConfigurationException(
                        "All keys of 'weights' have to match an input field. There is no input field '" + key + "'.");
            }
        }
        fieldNames.forEach(name -> weights.put(name, perField.weightOf(name)));
        return Collections.unmodifiableMap(weights);
    }

    /**
     * The single weight applied to a joint score.
     *
     * @throws IllPosedExerciseException if the fields carry different weights
     */
    public static double uniform(Map<String, Double> weights) {
        Set<Double> distinct = new HashSet<>(weights.values());
        if (distinct.size() != 1) {
            throw new IllPosedExerciseException(
                    "Joint scoring needs one weight for all input fields, got " + weights + ".");
        }
        return distinct.iterator().next();
    }
}
