package uk.gegc.quizforge.features.model.domain.model;

/**
 * Value type of an input field. Knows its placeholder values and how to score an
 * answer automatically against a solution.
 */
public interface ValueType {

    /**
     * Short type name announced to frontends when the field's widget is created.
     */
    String typeName();

    /**
     * The most obvious (and usually wrong) answer, e.g. {@code 0}.
     */
    Object trivialValue();

    /**
     * An arbitrary well-formed answer used to call score hooks without real answers.
     */
    Object dummyValue();

    double autoMaxScore();

    boolean matches(Object answer, Object solution);

    default double autoScore(Object answer, Object solution) {
        return matches(answer, solution) ? autoMaxScore() : 0.0;
    }
}
