package uk.gegc.quizforge.features.exercise.domain.model;

import uk.gegc.quizforge.shared.exception.ExerciseConfigurationException;

/**
 * Per-instance configuration of an exercise, validated before any hook runs.
 *
 * @param minDifficulty lower difficulty bound, {@code null} to use the global default
 * @param maxDifficulty upper difficulty bound, {@code null} to use the global default
 * @param weights       score weights
 */
public record ExerciseSettings(Double minDifficulty, Double maxDifficulty, WeightSpec weights) {

    public static final ExerciseSettings DEFAULT = new ExerciseSettings(null, null, WeightSpec.DEFAULT);

    public ExerciseSettings {
        requireDifficulty("min_difficulty", minDifficulty);
        requireDifficulty("max_difficulty", maxDifficulty);
        if (weights == null) {
            weights = WeightSpec.DEFAULT;
        }
    }

    public ExerciseSettings withWeights(WeightSpec weights) {
        return new ExerciseSettings(minDifficulty, maxDifficulty, weights);
    }

    public static void requireDifficulty(String label, Double difficulty) {
        if (difficulty != null && !(difficulty >= 0.0 && difficulty <= 1.0)) {
            throw new ExerciseConfigurationException(
                    "'" + label + "' has to be a number in [0, 1], got " + difficulty + ".");
        }
    }
}
