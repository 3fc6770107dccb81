package uk.gegc.quizforge.features.exercise.domain.model;

public enum TaxonomyLevel {
    KNOWLEDGE,
    COMPREHENSION,
    APPLICATION,
    ANALYSIS,
    SYNTHESIS,
    EVALUATION
}
