package com.venturegate.policy;

import java.util.List;
import java.util.Map;

/**
 * Partial policy write. Absent (null) fields are left as they are.
 */
public record GatePolicyUpdate(
    Integer minExperiments,
    List<String> requiredFitTypes,
    Integer minWeakEvidence,
    Integer minMediumEvidence,
    Integer minStrongEvidence,
    Map<String, Double> thresholds,
    List<String> overrideRoles,
    Boolean requiresApproval
) {
}
