package uk.gegc.quizforge.features.runner.domain.message;

public record CreateWidget(String sender, String widgetId, String widgetType) implements ExerciseMessage {
}
