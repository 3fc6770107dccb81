package uk.gegc.quizforge.features.runner.domain.message;

/**
 * Asks frontends to render a piece of text: the preamble, the problem or the feedback.
 */
public record RenderTemplate(String sender, String templateType, String template) implements ExerciseMessage {
}
