package uk.gegc.quizforge.features.pool.domain.model;

/**
 * Element of an exercise pool: either a single exercise or a nested pool.
 */
public interface PoolItem {

    /**
     * Human readable label, or {@code null} when the item has none.
     */
    String label();
}
