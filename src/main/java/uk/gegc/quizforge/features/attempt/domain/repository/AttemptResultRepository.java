package uk.gegc.quizforge.features.attempt.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import uk.gegc.quizforge.features.attempt.domain.model.AttemptResult;

import java.util.List;
import java.util.UUID;

@Repository
public interface AttemptResultRepository extends JpaRepository<AttemptResult, UUID> {

    List<AttemptResult> findByExerciseIdOrderBySubmittedAtDesc(String exerciseId);

    List<AttemptResult> findByUserIdOrderBySubmittedAtDesc(Long userId);
}
