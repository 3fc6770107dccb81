package uk.gegc.quizforge.features.runner.domain.message;

/**
 * Announces an attribute of the running exercise, e.g. its parameters or total score.
 */
public record ExerciseAttribute(String sender, String attributeName, Object attributeValue)
        implements ExerciseMessage {
}
