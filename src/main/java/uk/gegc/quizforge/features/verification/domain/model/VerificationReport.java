package uk.gegc.quizforge.features.verification.domain.model;

import java.util.List;

public record VerificationReport(String exerciseName, List<CheckResult> checks) {

    public VerificationReport {
        checks = List.copyOf(checks);
    }

    public boolean passed() {
        return checks.stream().allMatch(CheckResult::passed);
    }

    public List<CheckResult> failures() {
        return checks.stream().filter(check -> !check.passed()).toList();
    }
}
