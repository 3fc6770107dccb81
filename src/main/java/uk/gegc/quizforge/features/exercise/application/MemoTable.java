package uk.gegc.quizforge.features.exercise.application;

import lombok.extern.slf4j.Slf4j;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Per-attempt slots for derived values. A slot is computed on first read and returns the
 * stored value afterwards. A computation that throws leaves its slot unresolved.
 */
@Slf4j
final class MemoTable {

    private final Map<DerivedValue, Object> resolved = new EnumMap<>(DerivedValue.class);
    private final Set<DerivedValue> computing = EnumSet.noneOf(DerivedValue.class);

    @SuppressWarnings("unchecked")
    <T> T get(DerivedValue slot, Supplier<T> computation) {
        if (resolved.containsKey(slot)) {
            return (T) resolved.get(slot);
        }
        if (!computing.add(slot)) {
            throw new IllegalStateException("Cyclic dependency while computing " + slot);
        }
        try {
            log.debug("Computing {}", slot);
            T value = computation.get();
            resolved.put(slot, value);
            return value;
        } finally {
            computing.remove(slot);
        }
    }

    boolean isResolved(DerivedValue slot) {
        return resolved.containsKey(slot);
    }
}
