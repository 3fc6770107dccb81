package uk.gegc.quizforge.features.runner.domain.message;

public record WaitingForSubmission(String sender) implements ExerciseMessage {
}
