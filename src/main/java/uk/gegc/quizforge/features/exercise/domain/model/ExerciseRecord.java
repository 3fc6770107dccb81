package uk.gegc.quizforge.features.exercise.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Lob;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Stored exercise definition, keyed by the hash of its source.
 */
@Entity
@Getter
@Setter
@NoArgsConstructor
@Table(name = "exercises")
public class ExerciseRecord {

    @Id
    @Column(name = "id", length = 64, updatable = false, nullable = false)
    private String id;

    @Lob
    @Column(name = "source", nullable = false)
    private String source;

    @Column(name = "label", nullable = false)
    private String label;

    @Column(name = "score_maximum")
    private Double scoreMaximum;
}
