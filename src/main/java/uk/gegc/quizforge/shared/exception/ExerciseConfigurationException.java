package uk.gegc.quizforge.shared.exception;

/**
 * Exception thrown when exercise or pool settings are invalid
 * (difficulty outside [0, 1], negative or unknown weights, weight keys without a field).
 */
public class ExerciseConfigurationException extends RuntimeException {

    public ExerciseConfigurationException(String message) {
        super(message);
    }

    public ExerciseConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
