package com.venturegate.policy;

import com.venturegate.evidence.FitType;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Hard-coded per-gate policy used whenever an actor has not customized a field.
 * Override roles are not part of the defaults; they fall back to {@link #DEFAULT_OVERRIDE_ROLES}.
 */
public record GatePolicyDefaults(
    int minExperiments,
    List<FitType> requiredFitTypes,
    int minWeakEvidence,
    int minMediumEvidence,
    int minStrongEvidence,
    Map<String, Double> thresholds,
    boolean requiresApproval
) {

    public static final List<String> DEFAULT_OVERRIDE_ROLES = List.of("admin", "senior_consultant");

    private static final Map<Gate, GatePolicyDefaults> BY_GATE = new EnumMap<>(Map.of(
        Gate.DESIRABILITY, new GatePolicyDefaults(3, List.of(FitType.DESIRABILITY), 0, 1, 1,
            Map.of("fit_score", 70.0, "ctr", 0.02), true),
        Gate.FEASIBILITY, new GatePolicyDefaults(2, List.of(FitType.FEASIBILITY), 0, 1, 1,
            Map.of("feasibility_score", 60.0), true),
        Gate.VIABILITY, new GatePolicyDefaults(2, List.of(FitType.VIABILITY), 0, 1, 1,
            Map.of("ltv_cac_ratio", 3.0), true)
    ));

    public GatePolicyDefaults {
        requiredFitTypes = List.copyOf(requiredFitTypes);
        thresholds = Map.copyOf(thresholds);
    }

    public static GatePolicyDefaults forGate(Gate gate) {
        return BY_GATE.get(gate);
    }
}
