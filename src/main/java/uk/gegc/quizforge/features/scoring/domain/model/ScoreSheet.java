package uk.gegc.quizforge.features.scoring.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Weighted scores per input field plus their total.
 * A {@code null} field score means the field was not evaluated on its own.
 */
public record ScoreSheet(Map<String, Double> perField, double total) {

    public ScoreSheet {
        perField = Collections.unmodifiableMap(new LinkedHashMap<>(perField));
    }
}
