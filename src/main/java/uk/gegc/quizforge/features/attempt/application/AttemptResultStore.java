package uk.gegc.quizforge.features.attempt.application;

import uk.gegc.quizforge.features.attempt.domain.model.AttemptResult;

import java.time.Instant;

/**
 * Persistence of attempts. All operations are idempotent upserts except
 * {@link #appendResult}, which records one more result.
 */
public interface AttemptResultStore {

    /**
     * @return the id of the user with the given name, created if necessary
     */
    Long ensureUser(String userName);

    /**
     * Records an exercise definition unless one with the same content hash exists.
     */
    void ensureExercise(String exerciseId, String source, String label, double scoreMaximum);

    AttemptResult appendResult(String exerciseId, Long userId, Instant startedAt, Instant submittedAt,
                               double scoreGiven);
}
