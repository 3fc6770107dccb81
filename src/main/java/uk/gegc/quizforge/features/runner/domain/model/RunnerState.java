package uk.gegc.quizforge.features.runner.domain.model;

/**
 * Lifecycle of one exercise attempt. States are visited strictly in declaration order.
 */
public enum RunnerState {
    CREATED,
    RENDERING,
    AWAITING_SUBMISSION,
    FINISHING,
    DONE;

    public boolean canTransitionTo(RunnerState targetState) {
        if (targetState == null) {
            return false;
        }
        return targetState.ordinal() == ordinal() + 1;
    }

    public boolean isTerminal() {
        return this == DONE;
    }
}
