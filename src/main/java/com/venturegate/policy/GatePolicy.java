package com.venturegate.policy;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.venturegate.evidence.FitType;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Effective policy for one gate: an actor's override merged field by field over the defaults.
 * {@code id} is null and {@code custom} false when no override exists.
 */
public record GatePolicy(
    String id,
    Gate gate,
    @JsonProperty("isCustom") boolean custom,
    int minExperiments,
    List<FitType> requiredFitTypes,
    int minWeakEvidence,
    int minMediumEvidence,
    int minStrongEvidence,
    Map<String, Double> thresholds,
    List<String> overrideRoles,
    boolean requiresApproval
) {

    public GatePolicy {
        requiredFitTypes = List.copyOf(requiredFitTypes);
        thresholds = Collections.unmodifiableMap(new TreeMap<>(thresholds));
        overrideRoles = List.copyOf(overrideRoles);
    }

    public static GatePolicy defaultsFor(Gate gate) {
        GatePolicyDefaults defaults = GatePolicyDefaults.forGate(gate);
        return new GatePolicy(null, gate, false,
            defaults.minExperiments(),
            defaults.requiredFitTypes(),
            defaults.minWeakEvidence(),
            defaults.minMediumEvidence(),
            defaults.minStrongEvidence(),
            defaults.thresholds(),
            GatePolicyDefaults.DEFAULT_OVERRIDE_ROLES,
            defaults.requiresApproval());
    }
}
