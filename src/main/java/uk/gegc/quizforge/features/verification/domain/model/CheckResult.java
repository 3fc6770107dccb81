package uk.gegc.quizforge.features.verification.domain.model;

/**
 * Outcome of one self-check of an exercise.
 */
public record CheckResult(String name, boolean passed, String message) {

    public static CheckResult passed(String name) {
        return new CheckResult(name, true, null);
    }

    public static CheckResult failed(String name, String message) {
        return new CheckResult(name, false, message);
    }
}
