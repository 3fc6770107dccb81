package uk.gegc.quizforge.features.pool.domain.model;

import uk.gegc.quizforge.features.exercise.domain.model.ExerciseDefinition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Description of a pool tree for frontends. Exercises appear as {@code <n>_<name>}
 * strings, nested pools as nested structures.
 */
public record PoolStructure(String title,
                            NavigationMode navigation,
                            Map<Integer, Double> weights,
                            Integer select,
                            boolean shuffle,
                            List<Object> items) {

    public PoolStructure {
        weights = Collections.unmodifiableMap(new LinkedHashMap<>(weights));
        items = Collections.unmodifiableList(new ArrayList<>(items));
    }

    public static PoolStructure of(ExercisePool pool) {
        return of(pool, pool.getTitle());
    }

    private static PoolStructure of(ExercisePool pool, String title) {
        List<Object> items = new ArrayList<>();
        int exerciseCount = 0;
        int poolCount = 0;
        for (PoolItem item : pool.getItems()) {
            if (item instanceof ExerciseDefinition definition) {
                items.add(exerciseCount + "_" + definition.getName());
                exerciseCount++;
            } else if (item instanceof ExercisePool subPool) {
                items.add(of(subPool, subPool.segmentName(poolCount)));
                poolCount++;
            }
        }
        return new PoolStructure(title, pool.getNavigation(), pool.getWeights(), pool.getSelect(),
                pool.isShuffle(), items);
    }
}
