package com.venturegate.policy;

import com.venturegate.evidence.FitType;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * One actor's stored customization of one gate. Every policy field is nullable; a null
 * field inherits the gate default.
 */
public record GatePolicyOverride(
    String id,
    String actorId,
    Gate gate,
    Integer minExperiments,
    List<FitType> requiredFitTypes,
    Integer minWeakEvidence,
    Integer minMediumEvidence,
    Integer minStrongEvidence,
    Map<String, Double> thresholds,
    List<String> overrideRoles,
    Boolean requiresApproval,
    Instant updatedAt
) {

    public GatePolicyOverride {
        requiredFitTypes = requiredFitTypes == null ? null : List.copyOf(requiredFitTypes);
        thresholds = thresholds == null ? null : Map.copyOf(thresholds);
        overrideRoles = overrideRoles == null ? null : List.copyOf(overrideRoles);
    }

    public static GatePolicyOverride empty(String id, String actorId, Gate gate, Instant updatedAt) {
        return new GatePolicyOverride(id, actorId, gate, null, null, null, null, null, null, null, null, updatedAt);
    }

    /** Fields present in {@code update} replace this override's; the others are kept. */
    GatePolicyOverride apply(GatePolicyUpdate update, List<FitType> fitTypes, Instant now) {
        return new GatePolicyOverride(
            id,
            actorId,
            gate,
            update.minExperiments() != null ? update.minExperiments() : minExperiments,
            fitTypes != null ? fitTypes : requiredFitTypes,
            update.minWeakEvidence() != null ? update.minWeakEvidence() : minWeakEvidence,
            update.minMediumEvidence() != null ? update.minMediumEvidence() : minMediumEvidence,
            update.minStrongEvidence() != null ? update.minStrongEvidence() : minStrongEvidence,
            update.thresholds() != null ? update.thresholds() : thresholds,
            update.overrideRoles() != null ? update.overrideRoles() : overrideRoles,
            update.requiresApproval() != null ? update.requiresApproval() : requiresApproval,
            now
        );
    }
}
