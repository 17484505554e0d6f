package com.venturegate.gate;

import com.venturegate.aggregation.UnifiedEvidenceItem;
import com.venturegate.evidence.EvidenceStrength;
import com.venturegate.policy.GatePolicy;

import java.util.List;
import java.util.Map;

/**
 * Compares the item count in one strength bucket with that bucket's minimum. Buckets are
 * checked independently; a surplus of strong evidence does not cover a medium shortfall.
 */
public class StrengthMinimumCriterion implements GateCriterion {

    private final EvidenceStrength strength;

    public StrengthMinimumCriterion(EvidenceStrength strength) {
        this.strength = strength;
    }

    @Override
    public String criterionId() {
        return "min-" + strength.getValue() + "-evidence";
    }

    @Override
    public List<Outcome> evaluate(List<UnifiedEvidenceItem> evidence, GatePolicy policy, Map<String, Double> metrics) {
        long count = evidence.stream().filter(item -> item.strength() == strength).count();
        if (count >= minimum(policy)) {
            return List.of(new Outcome.Met());
        }
        return List.of(new Outcome.Unmet("insufficient_" + strength.getValue() + "_evidence"));
    }

    private int minimum(GatePolicy policy) {
        return switch (strength) {
            case WEAK -> policy.minWeakEvidence();
            case MEDIUM -> policy.minMediumEvidence();
            case STRONG -> policy.minStrongEvidence();
        };
    }
}
