package uk.gegc.quizforge.features.pool.application;

import uk.gegc.quizforge.features.exercise.domain.model.ExerciseDefinition;
import uk.gegc.quizforge.features.pool.domain.model.ExercisePool;
import uk.gegc.quizforge.features.pool.domain.model.PoolItem;
import uk.gegc.quizforge.features.pool.domain.model.WeightedExercise;

import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Aggregates exercise results over a pool tree: every child contributes its
 * (total, max) pair multiplied by its weight, recursively.
 */
public final class PoolScoreAggregator {

    private PoolScoreAggregator() {
    }

    /**
     * @param results unweighted results keyed by exercise path, as produced by
     *                {@link ExercisePool#exercises()}; exercises without a result are skipped
     */
    public static PoolScore aggregate(ExercisePool pool, Map<String, PoolScore> results) {
        Iterator<WeightedExercise> paths = pool.exercises().iterator();
        return aggregate(pool, paths, results);
    }

    private static PoolScore aggregate(ExercisePool pool, Iterator<WeightedExercise> paths,
                                       Map<String, PoolScore> results) {
        PoolScore sum = PoolScore.ZERO;
        List<PoolItem> items = pool.getItems();
        for (int i = 0; i < items.size(); i++) {
            PoolItem item = items.get(i);
            PoolScore child = null;
            if (item instanceof ExerciseDefinition) {
                child = results.get(paths.next().path());
            } else if (item instanceof ExercisePool subPool) {
                child = aggregate(subPool, paths, results);
            }
            if (child != null) {
                sum = sum.plus(child.scaledBy(pool.weightOf(i)));
            }
        }
        return sum;
    }
}
