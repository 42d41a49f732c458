package com.calor.verification.solver;

import java.time.Duration;

/**
 * Outcome of verifying one contract. {@code counterexample} is null unless the solver produced one.
 */
public record VerificationResult(VerificationStatus status, String counterexample, Duration duration) {

    public VerificationResult {
        if (status == null) throw new IllegalArgumentException("status is required");
        if (duration == null) duration = Duration.ZERO;
    }

    public static VerificationResult proven(Duration duration) {
        return new VerificationResult(VerificationStatus.PROVEN, null, duration);
    }

    public static VerificationResult disproven(String counterexample, Duration duration) {
        return new VerificationResult(VerificationStatus.DISPROVEN, counterexample, duration);
    }

    public static VerificationResult unsupported(Duration duration) {
        return new VerificationResult(VerificationStatus.UNSUPPORTED, null, duration);
    }

    public static VerificationResult skipped(Duration duration) {
        return new VerificationResult(VerificationStatus.SKIPPED, null, duration);
    }
}
