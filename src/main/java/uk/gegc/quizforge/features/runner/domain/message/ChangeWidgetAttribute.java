package uk.gegc.quizforge.features.runner.domain.message;

/**
 * Widget state change. Outbound for solutions, scores and correctness; inbound with
 * attribute {@value #VALUE} when a user edits an answer.
 */
public record ChangeWidgetAttribute(String sender, String widgetId, String attributeName, Object attributeValue)
        implements ExerciseMessage {

    public static final String VALUE = "value";
}
