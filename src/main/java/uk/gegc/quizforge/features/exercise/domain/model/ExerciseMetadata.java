package uk.gegc.quizforge.features.exercise.domain.model;

import lombok.Builder;
import lombok.Singular;

import java.util.List;

/**
 * Descriptive attributes of an exercise. All of them are optional.
 */
@Builder(toBuilder = true)
public record ExerciseMetadata(
        String title,
        String subtitle,
        String author,
        String language,
        String license,
        String url,
        String origin,
        String discipline,
        String area,
        @Singular List<String> topics,
        @Singular List<String> keywords,
        @Singular("taxonomy") List<TaxonomyLevel> taxonomy
) {

    public static ExerciseMetadata empty() {
        return ExerciseMetadata.builder().build();
    }
}
