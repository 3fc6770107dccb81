package uk.gegc.quizforge.shared.exception;

import uk.gegc.quizforge.features.runner.domain.model.RunnerState;

/**
 * Exception thrown when an exercise runner is asked to perform a step out of order,
 * for instance a submission before the runner awaits one.
 */
public class InvalidRunnerStateException extends RuntimeException {

    private final RunnerState current;
    private final RunnerState requested;

    public InvalidRunnerStateException(RunnerState current, RunnerState requested) {
        super("Cannot transition exercise runner from " + current + " to " + requested);
        this.current = current;
        this.requested = requested;
    }

    public RunnerState getCurrent() {
        return current;
    }

    public RunnerState getRequested() {
        return requested;
    }
}
