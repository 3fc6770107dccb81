package uk.gegc.quizforge.features.exercise.domain.hook;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of a {@code the_solution} or {@code a_solution} hook.
 * A bare value is only legal for exercises with exactly one input field.
 */
public sealed interface SolutionResult {

    static SolutionResult none() {
        return None.INSTANCE;
    }

    static SolutionResult single(Object value) {
        return value == null ? None.INSTANCE : new Single(value);
    }

    static SolutionResult perField(Map<String, ?> values) {
        return values == null ? None.INSTANCE : new PerField(new LinkedHashMap<>(values));
    }

    enum None implements SolutionResult {
        INSTANCE
    }

    record Single(Object value) implements SolutionResult {
    }

    record PerField(Map<String, Object> values) implements SolutionResult {
        public PerField {
            values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        }
    }
}
