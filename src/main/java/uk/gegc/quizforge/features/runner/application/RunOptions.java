package uk.gegc.quizforge.features.runner.application;

import lombok.Builder;
import uk.gegc.quizforge.features.runner.domain.model.AttemptCallback;

import java.util.Map;
import java.util.Random;

/**
 * Per-attempt options. Unset values fall back to the configured defaults.
 *
 * @param debug      reveal solutions while rendering
 * @param difficulty fixed difficulty in [0, 1], or {@code null} to draw one
 * @param userName   attempting user, or {@code null} for the configured default
 * @param extras     additional global parameters exposed to hooks
 * @param callback   invoked with the total and maximal score once the attempt is scored
 * @param random     source of randomness, or {@code null} for a fresh one
 */
@Builder
public record RunOptions(boolean debug,
                         Double difficulty,
                         String userName,
                         Map<String, Object> extras,
                         AttemptCallback callback,
                         Random random) {

    public static RunOptions defaults() {
        return RunOptions.builder().build();
    }
}
