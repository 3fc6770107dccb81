package uk.gegc.quizforge.features.runner.domain.model;

/**
 * Invoked once an attempt is scored, e.g. to report the result to an enclosing pool.
 */
@FunctionalInterface
public interface AttemptCallback {

    void onCompleted(double totalScore, double maxTotalScore);
}
