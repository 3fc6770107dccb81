package uk.gegc.quizforge.features.exercise.application;

/**
 * Memoized values of a parametrized exercise, listed in dependency order.
 */
public enum DerivedValue {
    SOURCE,
    ID,
    PARAMETERS,
    MODEL,
    TEMPLATE,
    PREAMBLE,
    THE_SOLUTION,
    A_SOLUTION,
    SOLUTION,
    HINTS,
    TRIVIAL_INPUT,
    DUMMY_INPUT,
    SCORE_WEIGHTS,
    MAX_SCORES,
    SCORES,
    CORRECT
}
