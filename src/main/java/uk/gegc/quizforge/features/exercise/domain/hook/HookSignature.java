package uk.gegc.quizforge.features.exercise.domain.hook;

import uk.gegc.quizforge.shared.exception.MissingParameterException;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Declared keyword names of a hook, registered together with the hook body.
 * <p>
 * Required names must be present in the keyword bag; optional names fall back to their
 * default. Keywords the signature does not declare are never passed to the hook.
 * </p>
 */
public final class HookSignature {

    private static final HookSignature NONE = new HookSignature(List.of(), Map.of());

    private final List<String> required;
    private final Map<String, Object> defaults;

    private HookSignature(List<String> required, Map<String, Object> defaults) {
        this.required = List.copyOf(required);
        this.defaults = Collections.unmodifiableMap(new LinkedHashMap<>(defaults));
    }

    public static HookSignature none() {
        return NONE;
    }

    public static HookSignature of(String... required) {
        return new HookSignature(List.of(required), Map.of());
    }

    public static HookSignature of(Collection<String> required) {
        return new HookSignature(List.copyOf(required), Map.of());
    }

    /**
     * Returns a copy that additionally declares {@code name} with a default value.
     */
    public HookSignature withDefault(String name, Object defaultValue) {
        if (required.contains(name)) {
            throw new IllegalArgumentException("Parameter '" + name + "' is already declared as required");
        }
        Map<String, Object> extended = new LinkedHashMap<>(defaults);
        extended.put(name, defaultValue);
        return new HookSignature(required, extended);
    }

    public Map<String, Object> getDefaults() {
        return defaults;
    }

    public Set<String> names() {
        Set<String> names = new LinkedHashSet<>(required);
        names.addAll(defaults.keySet());
        return names;
    }

    /**
     * Selects the keywords this signature declares from {@code bag}.
     *
     * @throws MissingParameterException if a required name is absent from the bag
     */
    public Map<String, Object> bind(Map<String, ?> bag) {
        Map<String, Object> bound = new LinkedHashMap<>();
        for (String name : required) {
            if (!bag.containsKey(name)) {
                throw new MissingParameterException(name, bag.keySet());
            }
            bound.put(name, bag.get(name));
        }
        defaults.forEach((name, defaultValue) ->
                bound.put(name, bag.containsKey(name) ? bag.get(name) : defaultValue));
        return bound;
    }

    @Override
    public String toString() {
        return "HookSignature" + names();
    }
}
