package com.venturegate.boundary;

/**
 * Per-call validation policy.
 *
 * @param source          label attached to logged issues
 * @param mode            open or closed
 * @param strict          forces closed behaviour regardless of {@code mode} (staging/test environments)
 * @param sampleRate      probability in [0, 1] that a batch's issues are logged
 * @param maxLoggedIssues cap on the number of issues written per log line
 */
public record BoundaryValidationPolicy(
    String source,
    ValidationMode mode,
    boolean strict,
    double sampleRate,
    int maxLoggedIssues
) {

    public static final int DEFAULT_MAX_LOGGED_ISSUES = 10;

    public BoundaryValidationPolicy {
        if (source == null || source.isBlank()) {
            source = "evidence-boundary";
        }
        if (mode == null) {
            mode = ValidationMode.OPEN;
        }
        sampleRate = Double.isNaN(sampleRate) ? 0 : Math.min(1, Math.max(0, sampleRate));
        if (maxLoggedIssues < 0) {
            maxLoggedIssues = 0;
        }
    }

    public static BoundaryValidationPolicy open() {
        return new BoundaryValidationPolicy(null, ValidationMode.OPEN, false, 1.0, DEFAULT_MAX_LOGGED_ISSUES);
    }

    public static BoundaryValidationPolicy closed() {
        return new BoundaryValidationPolicy(null, ValidationMode.CLOSED, false, 1.0, DEFAULT_MAX_LOGGED_ISSUES);
    }

    public boolean failClosed() {
        return mode == ValidationMode.CLOSED || strict;
    }

    public BoundaryValidationPolicy withMode(ValidationMode newMode) {
        return new BoundaryValidationPolicy(source, newMode, strict, sampleRate, maxLoggedIssues);
    }

    public BoundaryValidationPolicy withStrict(boolean newStrict) {
        return new BoundaryValidationPolicy(source, mode, newStrict, sampleRate, maxLoggedIssues);
    }

    public BoundaryValidationPolicy withSampleRate(double newSampleRate) {
        return new BoundaryValidationPolicy(source, mode, strict, newSampleRate, maxLoggedIssues);
    }
}
