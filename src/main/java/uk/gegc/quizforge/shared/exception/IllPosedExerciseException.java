package uk.gegc.quizforge.shared.exception;

/**
 * Exception thrown when an exercise definition contradicts itself, e.g. an output field
 * without a matching parameter or a hook returning a shape that cannot be interpreted.
 * Indicates an authoring defect and is never recovered from.
 */
public class IllPosedExerciseException extends RuntimeException {

    public IllPosedExerciseException(String message) {
        super(message);
    }

    public IllPosedExerciseException(String message, Throwable cause) {
        super(message, cause);
    }
}
