package uk.gegc.quizforge.features.pool.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How a frontend lets users move through the items of a pool.
 */
public enum NavigationMode {
    /**
     * Items may be visited in any order.
     */
    FREE,
    /**
     * Items are visited in index order.
     */
    SEQUENTIAL;

    @JsonValue
    public String jsonValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
