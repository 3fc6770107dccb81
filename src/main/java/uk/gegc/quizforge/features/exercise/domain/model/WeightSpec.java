package uk.gegc.quizforge.features.exercise.domain.model;

import uk.gegc.quizforge.shared.exception.ExerciseConfigurationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Score weights of an exercise: one weight for every input field, or weights by field name.
 */
public sealed interface WeightSpec {

    WeightSpec DEFAULT = new Uniform(1.0);

    static WeightSpec uniform(double weight) {
        return new Uniform(weight);
    }

    static WeightSpec perField(Map<String, ? extends Number> weights) {
        Map<String, Double> converted = new LinkedHashMap<>();
        weights.forEach((name, value) -> {
            if (value == null) {
                throw new ExerciseConfigurationException("Weight of field '" + name + "' must not be null.");
            }
            converted.put(name, value.doubleValue());
        });
        return new PerField(converted, 1.0);
    }

    /**
     * Interprets a loosely typed weight value, e.g. one read from configuration.
     *
     * @throws ExerciseConfigurationException for anything but a number or a map of numbers
     */
    static WeightSpec from(Object value) {
        if (value == null) {
            return DEFAULT;
        }
        if (value instanceof Number number) {
            return new Uniform(number.doubleValue());
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Double> converted = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (!(entry.getKey() instanceof String key)) {
                    throw new ExerciseConfigurationException(
                            "All keys of 'weights' have to be strings, got " + entry.getKey() + ".");
                }
                if (!(entry.getValue() instanceof Number number)) {
                    throw new ExerciseConfigurationException(
                            "All values of 'weights' have to be numbers, got " + entry.getValue() + ".");
                }
                converted.put(key, number.doubleValue());
            }
            return new PerField(converted, 1.0);
        }
        throw new ExerciseConfigurationException(
                "'weights' has to be a number or a map of numbers, got " + value.getClass().getSimpleName() + ".");
    }

    WeightSpec scaledBy(double factor);

    record Uniform(double weight) implements WeightSpec {
        public Uniform {
            requireValid("weights", weight);
        }

        @Override
        public WeightSpec scaledBy(double factor) {
            return new Uniform(weight * factor);
        }
    }

    /**
     * Weights by field name; fields not named weigh {@code defaultWeight}.
     */
    record PerField(Map<String, Double> weights, double defaultWeight) implements WeightSpec {
        public PerField {
            weights.forEach((name, weight) -> requireValid("weights['" + name + "']", weight));
            requireValid("weights", defaultWeight);
            weights = Collections.unmodifiableMap(new LinkedHashMap<>(weights));
        }

        public double weightOf(String name) {
            return weights.getOrDefault(name, defaultWeight);
        }

        @Override
        public WeightSpec scaledBy(double factor) {
            Map<String, Double> scaled = new LinkedHashMap<>();
            weights.forEach((name, weight) -> scaled.put(name, weight * factor));
            return new PerField(scaled, defaultWeight * factor);
        }
    }

    private static void requireValid(String label, double weight) {
        if (Double.isNaN(weight) || Double.isInfinite(weight) || weight < 0.0) {
            throw new ExerciseConfigurationException(
                    "'" + label + "' has to be a non-negative number, got " + weight + ".");
        }
    }
}
