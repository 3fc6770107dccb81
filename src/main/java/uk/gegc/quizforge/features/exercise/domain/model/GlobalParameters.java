package uk.gegc.quizforge.features.exercise.domain.model;

import uk.gegc.quizforge.shared.exception.ExerciseConfigurationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Process wide defaults for one attempt. Besides the difficulty range and the user name,
 * extra keywords may be passed on to the {@code parameters} hook.
 */
public record GlobalParameters(double minDifficulty, double maxDifficulty, String userName, Map<String, Object> extras) {

    public static final String MIN_DIFFICULTY = "min_difficulty";
    public static final String MAX_DIFFICULTY = "max_difficulty";
    public static final String USER_NAME = "user_name";
    public static final String DIFFICULTY = "difficulty";

    public GlobalParameters {
        ExerciseSettings.requireDifficulty(MIN_DIFFICULTY, minDifficulty);
        ExerciseSettings.requireDifficulty(MAX_DIFFICULTY, maxDifficulty);
        if (userName == null || userName.isBlank()) {
            throw new ExerciseConfigurationException("'user_name' must not be blank.");
        }
        extras = extras == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(extras));
    }

    public static GlobalParameters defaults() {
        return new GlobalParameters(0.0, 1.0, "John Doe", Map.of());
    }

    public GlobalParameters withUserName(String userName) {
        return new GlobalParameters(minDifficulty, maxDifficulty, userName, extras);
    }

    /**
     * Keyword bag offered to the {@code parameters} hook, without the sampled difficulty.
     */
    public Map<String, Object> asBag() {
        Map<String, Object> bag = new LinkedHashMap<>(extras);
        bag.put(MIN_DIFFICULTY, minDifficulty);
        bag.put(MAX_DIFFICULTY, maxDifficulty);
        bag.put(USER_NAME, userName);
        return bag;
    }
}
