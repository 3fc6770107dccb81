package uk.gegc.quizforge.features.exercise.domain.hook;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of a {@code scores} hook. One variant per legal return shape:
 * <ul>
 *     <li>{@link Automatic} - every field is scored by its value type</li>
 *     <li>{@link Joint} - one number, or a (score, max) pair, for all fields together</li>
 *     <li>{@link PerField} - a score per field; a missing or {@code null} entry means
 *     the field falls back to automatic scoring</li>
 * </ul>
 */
public sealed interface ScoreResult {

    static ScoreResult automatic() {
        return Automatic.INSTANCE;
    }

    static ScoreResult joint(double score) {
        return new Joint(score, null);
    }

    static ScoreResult joint(double score, double maxScore) {
        return new Joint(score, maxScore);
    }

    static ScoreResult perField(Map<String, FieldScore> scores) {
        return scores == null ? Automatic.INSTANCE : new PerField(new LinkedHashMap<>(scores));
    }

    /**
     * Convenience for hooks returning plain numbers per field.
     */
    static ScoreResult perFieldScores(Map<String, ? extends Number> scores) {
        if (scores == null) {
            return Automatic.INSTANCE;
        }
        Map<String, FieldScore> converted = new LinkedHashMap<>();
        scores.forEach((name, value) -> converted.put(name, value == null ? null : FieldScore.of(value.doubleValue())));
        return new PerField(converted);
    }

    enum Automatic implements ScoreResult {
        INSTANCE
    }

    record Joint(double score, Double maxScore) implements ScoreResult {
    }

    record PerField(Map<String, FieldScore> scores) implements ScoreResult {
        public PerField {
            scores = Collections.unmodifiableMap(new LinkedHashMap<>(scores));
        }
    }
}
