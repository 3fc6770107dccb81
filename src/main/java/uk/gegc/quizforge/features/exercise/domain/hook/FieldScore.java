package uk.gegc.quizforge.features.exercise.domain.hook;

/**
 * Score of a single input field, optionally with the maximum the hook grants for it.
 *
 * @param score    achieved score
 * @param maxScore maximal score, or {@code null} when the hook only returns a number
 */
public record FieldScore(double score, Double maxScore) {

    public static FieldScore of(double score) {
        return new FieldScore(score, null);
    }

    public static FieldScore of(double score, double maxScore) {
        return new FieldScore(score, maxScore);
    }
}
