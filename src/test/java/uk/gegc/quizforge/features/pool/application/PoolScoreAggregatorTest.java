package uk.gegc.quizforge.features.pool.application;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.quizforge.features.pool.domain.model.ExercisePool;
import uk.gegc.quizforge.features.pool.domain.model.WeightedExercise;
import uk.gegc.quizforge.testsupport.ExerciseFixtures;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PoolScoreAggregatorTest {

    private static ExercisePool pool() {
        ExercisePool inner = new ExercisePool("Sums").add(ExerciseFixtures.addition(), 3.0);
        return new ExercisePool()
                .add(ExerciseFixtures.fiveIsTheAnswer(), 2.0)
                .add(inner);
    }

    @Test
    @DisplayName("child results are scaled by their weights, recursively")
    void aggregate_weightedSum() {
        PoolScore score = PoolScoreAggregator.aggregate(pool(), Map.of(
                "/0_FiveIsTheAnswer", new PoolScore(5.0, 10.0),
                "/Sums/0_Addition", new PoolScore(1.0, 1.0)));

        assertThat(score).isEqualTo(new PoolScore(13.0, 23.0));
    }

    @Test
    @DisplayName("exercises without a result do not count")
    void aggregate_missingResults() {
        PoolScore score = PoolScoreAggregator.aggregate(pool(), Map.of("/Sums/0_Addition", new PoolScore(0.0, 1.0)));

        assertThat(score).isEqualTo(new PoolScore(0.0, 3.0));
    }

    @Test
    @DisplayName("a result counts only for the sibling pool it was reported for")
    void aggregate_siblingPoolsKeptApart() {
        ExercisePool pool = new ExercisePool()
                .add(new ExercisePool().add(ExerciseFixtures.addition()))
                .add(new ExercisePool().add(ExerciseFixtures.addition()));
        PoolResultTracker tracker = new PoolResultTracker(pool);

        tracker.callbackFor(pool.exercises().get(0).path()).onCompleted(1.0, 1.0);

        assertThat(pool.exercises()).extracting(WeightedExercise::path)
                .containsExactly("/0_subpool/0_Addition", "/1_subpool/0_Addition");
        assertThat(tracker.score()).isEqualTo(new PoolScore(1.0, 1.0));
    }

    @Test
    @DisplayName("the tracker collects results reported by runner callbacks")
    void tracker_collectsCallbacks() {
        PoolResultTracker tracker = new PoolResultTracker(pool());

        tracker.callbackFor("/0_FiveIsTheAnswer").onCompleted(10.0, 10.0);
        tracker.callbackFor("/Sums/0_Addition").onCompleted(0.0, 1.0);
        tracker.callbackFor("/Sums/0_Addition").onCompleted(1.0, 1.0);

        assertThat(tracker.results()).hasSize(2);
        assertThat(tracker.score()).isEqualTo(new PoolScore(23.0, 23.0));
    }
}
