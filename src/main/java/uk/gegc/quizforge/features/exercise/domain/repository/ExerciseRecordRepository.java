package uk.gegc.quizforge.features.exercise.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import uk.gegc.quizforge.features.exercise.domain.model.ExerciseRecord;

@Repository
public interface ExerciseRecordRepository extends JpaRepository<ExerciseRecord, String> {
}
