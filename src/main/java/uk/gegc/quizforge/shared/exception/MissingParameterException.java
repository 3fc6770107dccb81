package uk.gegc.quizforge.shared.exception;

import java.util.Set;

/**
 * Exception thrown when a hook requires a keyword that is not available.
 */
public class MissingParameterException extends RuntimeException {

    private final String parameterName;

    public MissingParameterException(String parameterName, Set<String> available) {
        super("Missing parameter: " + parameterName + ". Available: " + available);
        this.parameterName = parameterName;
    }

    public String getParameterName() {
        return parameterName;
    }
}
