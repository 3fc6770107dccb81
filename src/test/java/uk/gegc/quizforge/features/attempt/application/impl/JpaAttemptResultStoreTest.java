package uk.gegc.quizforge.features.attempt.application.impl;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.TestPropertySource;
import uk.gegc.quizforge.features.attempt.domain.model.AttemptResult;
import uk.gegc.quizforge.features.attempt.domain.repository.AttemptResultRepository;
import uk.gegc.quizforge.features.exercise.domain.model.ExerciseRecord;
import uk.gegc.quizforge.features.exercise.domain.repository.ExerciseRecordRepository;
import uk.gegc.quizforge.features.user.domain.repository.UserRepository;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@ActiveProfiles("test")
@Import(JpaAttemptResultStore.class)
@TestPropertySource(properties = {
        "spring.flyway.enabled=false",
        "spring.jpa.hibernate.ddl-auto=create-drop"
})
class JpaAttemptResultStoreTest {

    private static final String EXERCISE_ID = "a".repeat(64);

    @Autowired
    private JpaAttemptResultStore store;

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private ExerciseRecordRepository exerciseRecordRepository;

    @Autowired
    private AttemptResultRepository attemptResultRepository;

    @Test
    @DisplayName("ensureUser creates a user once and returns the same id afterwards")
    void ensureUser_isIdempotent() {
        Long first = store.ensureUser("Ada");
        Long second = store.ensureUser("Ada");

        assertThat(first).isNotNull().isEqualTo(second);
        assertThat(userRepository.findByName("Ada")).isPresent();
        assertThat(userRepository.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("ensureExercise keeps the first record for a content hash")
    void ensureExercise_isIdempotent() {
        store.ensureExercise(EXERCISE_ID, "source", "First", 10.0);
        store.ensureExercise(EXERCISE_ID, "source", "Second", 20.0);

        ExerciseRecord record = exerciseRecordRepository.findById(EXERCISE_ID).orElseThrow();
        assertThat(record.getLabel()).isEqualTo("First");
        assertThat(record.getScoreMaximum()).isEqualTo(10.0);
        assertThat(exerciseRecordRepository.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("appendResult records every attempt")
    void appendResult_appends() {
        Long userId = store.ensureUser("Ada");
        store.ensureExercise(EXERCISE_ID, "source", "Exercise", 10.0);
        Instant started = Instant.parse("2024-01-01T12:00:00Z");

        AttemptResult first = store.appendResult(EXERCISE_ID, userId, started, started.plusSeconds(30), 4.0);
        store.appendResult(EXERCISE_ID, userId, started, started.plusSeconds(60), 10.0);

        assertThat(first.getId()).isNotNull();
        List<AttemptResult> results = attemptResultRepository.findByExerciseIdOrderBySubmittedAtDesc(EXERCISE_ID);
        assertThat(results).extracting(AttemptResult::getScoreGiven).containsExactly(10.0, 4.0);
        assertThat(attemptResultRepository.findByUserIdOrderBySubmittedAtDesc(userId)).hasSize(2);
    }
}
