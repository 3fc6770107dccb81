package uk.gegc.quizforge.features.exercise.domain.hook;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of a {@code hints} hook: hints for the whole exercise or hints per input field.
 */
public sealed interface HintsResult {

    static HintsResult none() {
        return new General(List.of());
    }

    static HintsResult of(String... hints) {
        return new General(List.of(hints));
    }

    static HintsResult of(List<String> hints) {
        return new General(hints);
    }

    static HintsResult perField(Map<String, List<String>> hints) {
        return new PerField(hints);
    }

    record General(List<String> hints) implements HintsResult {
        public General {
            hints = List.copyOf(hints);
        }
    }

    record PerField(Map<String, List<String>> hints) implements HintsResult {
        public PerField {
            Map<String, List<String>> copy = new LinkedHashMap<>();
            hints.forEach((name, list) -> copy.put(name, list == null ? List.of() : List.copyOf(list)));
            hints = Collections.unmodifiableMap(copy);
        }
    }
}
