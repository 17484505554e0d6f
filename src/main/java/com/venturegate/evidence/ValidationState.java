package com.venturegate.evidence;

import java.time.Instant;

/**
 * One iteration of automated analysis for a project: a signal and an opaque evidence
 * payload per dimension. Payloads are nullable; a null payload means the dimension
 * produced no evidence at this iteration.
 */
public record ValidationState(
    String id,
    String projectId,
    int iteration,
    DesirabilitySignal desirabilitySignal,
    FeasibilitySignal feasibilitySignal,
    ViabilitySignal viabilitySignal,
    Object desirabilityEvidence,
    Object feasibilityEvidence,
    Object viabilityEvidence,
    Instant updatedAt
) {

    public Signal signal(Dimension dimension) {
        return switch (dimension) {
            case DESIRABILITY -> desirabilitySignal;
            case FEASIBILITY -> feasibilitySignal;
            case VIABILITY -> viabilitySignal;
        };
    }

    public Object evidence(Dimension dimension) {
        return switch (dimension) {
            case DESIRABILITY -> desirabilityEvidence;
            case FEASIBILITY -> feasibilityEvidence;
            case VIABILITY -> viabilityEvidence;
        };
    }
}
