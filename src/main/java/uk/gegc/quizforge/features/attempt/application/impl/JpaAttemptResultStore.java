package uk.gegc.quizforge.features.attempt.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.quizforge.features.attempt.application.AttemptResultStore;
import uk.gegc.quizforge.features.attempt.domain.model.AttemptResult;
import uk.gegc.quizforge.features.attempt.domain.repository.AttemptResultRepository;
import uk.gegc.quizforge.features.exercise.domain.model.ExerciseRecord;
import uk.gegc.quizforge.features.exercise.domain.repository.ExerciseRecordRepository;
import uk.gegc.quizforge.features.user.domain.model.User;
import uk.gegc.quizforge.features.user.domain.repository.UserRepository;

import java.time.Instant;

@Slf4j
@Service
@Transactional
@RequiredArgsConstructor
public class JpaAttemptResultStore implements AttemptResultStore {

    private final UserRepository userRepository;
    private final ExerciseRecordRepository exerciseRecordRepository;
    private final AttemptResultRepository attemptResultRepository;

    @Override
    public Long ensureUser(String userName) {
        return userRepository.findByName(userName)
                .orElseGet(() -> {
                    log.info("Registering user {}", userName);
                    return userRepository.save(new User(userName));
                })
                .getId();
    }

    @Override
    public void ensureExercise(String exerciseId, String source, String label, double scoreMaximum) {
        if (exerciseRecordRepository.existsById(exerciseId)) {
            return;
        }
        ExerciseRecord record = new ExerciseRecord();
        record.setId(exerciseId);
        record.setSource(source);
        record.setLabel(label);
        record.setScoreMaximum(scoreMaximum);
        exerciseRecordRepository.save(record);
        log.info("Recorded exercise {} ({})", label, exerciseId);
    }

    @Override
    public AttemptResult appendResult(String exerciseId, Long userId, Instant startedAt, Instant submittedAt,
                                      double scoreGiven) {
        AttemptResult result = new AttemptResult();
        result.setExerciseId(exerciseId);
        result.setUserId(userId);
        result.setStartedAt(startedAt);
        result.setSubmittedAt(submittedAt);
        result.setScoreGiven(scoreGiven);
        AttemptResult saved = attemptResultRepository.save(result);
        log.debug("Stored result {} for exercise {} and user {}", saved.getId(), exerciseId, userId);
        return saved;
    }
}
