package uk.gegc.quizforge.features.pool.application;

/**
 * Total and maximal score of an exercise or a pool.
 */
public record PoolScore(double total, double maxTotal) {

    public static final PoolScore ZERO = new PoolScore(0.0, 0.0);

    public PoolScore plus(PoolScore other) {
        return new PoolScore(total + other.total, maxTotal + other.maxTotal);
    }

    public PoolScore scaledBy(double weight) {
        return new PoolScore(total * weight, maxTotal * weight);
    }
}
