package uk.gegc.quizforge.features.exercise.domain.hook;

import uk.gegc.quizforge.shared.exception.MissingParameterException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Keyword arguments bound for one hook invocation.
 */
public final class HookArguments {

    private final Map<String, Object> values;

    public HookArguments(Map<String, ?> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public boolean has(String name) {
        return values.containsKey(name);
    }

    public Object get(String name) {
        if (!values.containsKey(name)) {
            throw new MissingParameterException(name, values.keySet());
        }
        return values.get(name);
    }

    public <T> T get(String name, Class<T> type) {
        Object value = get(name);
        if (value != null && !type.isInstance(value)) {
            throw new IllegalArgumentException("Parameter '" + name + "' is a "
                    + value.getClass().getSimpleName() + ", not a " + type.getSimpleName());
        }
        return type.cast(value);
    }

    public double getDouble(String name) {
        return number(name).doubleValue();
    }

    public int getInt(String name) {
        return number(name).intValue();
    }

    public long getLong(String name) {
        return number(name).longValue();
    }

    public String getString(String name) {
        Object value = get(name);
        return value == null ? null : value.toString();
    }

    public Map<String, Object> asMap() {
        return values;
    }

    private Number number(String name) {
        Object value = get(name);
        if (value instanceof Number number) {
            return number;
        }
        if (value instanceof String text) {
            try {
                return Double.valueOf(text.trim());
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("Parameter '" + name + "' is not numeric: " + text, ex);
            }
        }
        throw new IllegalArgumentException("Parameter '" + name + "' is not numeric: " + value);
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
