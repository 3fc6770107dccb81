package uk.gegc.quizforge.features.pool.domain.model;

import uk.gegc.quizforge.features.exercise.domain.model.ExerciseDefinition;

/**
 * An exercise of a pool tree with its path identifier and effective weight.
 *
 * @param path   slash separated position, e.g. {@code /Algebra/0_Quadratic}
 * @param weight product of the pool weights along the path
 */
public record WeightedExercise(String path, ExerciseDefinition definition, double weight) {

    /**
     * Definition whose score weights are multiplied by the effective weight.
     */
    public ExerciseDefinition weightedDefinition() {
        return weight == 1.0 ? definition : definition.scaledBy(weight);
    }
}
