package uk.gegc.quizforge.features.pool.application;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import uk.gegc.quizforge.features.pool.domain.model.ExercisePool;
import uk.gegc.quizforge.features.runner.domain.model.AttemptCallback;

import java.util.Collections;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Collects the results of the exercises of one pool as their runners finish.
 * Results are stored unweighted; the pool weights are applied on aggregation.
 */
@Slf4j
public class PoolResultTracker {

    @Getter
    private final ExercisePool pool;
    private final Map<String, PoolScore> results = new ConcurrentHashMap<>();

    public PoolResultTracker(ExercisePool pool) {
        this.pool = pool;
    }

    /**
     * Callback for the runner of the exercise at {@code path}. A repeated attempt
     * replaces the previous result.
     */
    public AttemptCallback callbackFor(String path) {
        return (total, maxTotal) -> {
            log.debug("Result for {}: {} of {}", path, total, maxTotal);
            results.put(path, new PoolScore(total, maxTotal));
        };
    }

    public Map<String, PoolScore> results() {
        return Collections.unmodifiableMap(results);
    }

    public PoolScore score() {
        return PoolScoreAggregator.aggregate(pool, results);
    }
}
