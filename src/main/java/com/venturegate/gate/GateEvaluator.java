package com.venturegate.gate;

import com.venturegate.aggregation.EvidenceAggregator;
import com.venturegate.aggregation.UnifiedEvidenceItem;
import com.venturegate.evidence.Dimension;
import com.venturegate.evidence.FitType;
import com.venturegate.policy.GatePolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Deterministic gate evaluator. Runs every criterion against the evidence restricted to the
 * policy's required fit types; the gate passes only if no criterion is unmet.
 * <p>
 * Unlike first-failure arbitration, every criterion is evaluated so the caller sees all
 * shortfalls at once. Never throws.
 */
public class GateEvaluator {

    private static final Logger log = LoggerFactory.getLogger(GateEvaluator.class);

    public static final String NO_EVIDENCE = "no_evidence";

    private final List<GateCriterion> criteria;

    public GateEvaluator(List<GateCriterion> criteria) {
        this.criteria = List.copyOf(criteria);
    }

    public GateEvaluation evaluate(List<UnifiedEvidenceItem> evidence, GatePolicy policy, Map<String, Double> metrics) {
        List<UnifiedEvidenceItem> restricted = restrict(evidence == null ? List.of() : evidence, policy);
        Map<String, Double> suppliedMetrics = metrics == null ? Map.of() : metrics;

        boolean pass = true;
        List<String> reasons = new ArrayList<>();
        if (restricted.isEmpty()) {
            pass = false;
            reasons.add(NO_EVIDENCE);
        }

        for (GateCriterion criterion : criteria) {
            for (GateCriterion.Outcome outcome : criterion.evaluate(restricted, policy, suppliedMetrics)) {
                if (outcome instanceof GateCriterion.Outcome.Unmet unmet) {
                    pass = false;
                    reasons.add(unmet.reason());
                } else if (outcome instanceof GateCriterion.Outcome.Unverified unverified) {
                    reasons.add(unverified.reason());
                }
            }
        }

        GateEvaluation evaluation = new GateEvaluation(
            policy.gate(),
            pass,
            policy.requiresApproval(),
            reasons,
            restricted.size(),
            ExperimentCountCriterion.countExperiments(restricted)
        );
        log.info("Gate {} evaluated: pass={} needsApproval={} reasons={}",
            policy.gate(), evaluation.pass(), evaluation.needsApproval(), evaluation.reasons());
        return evaluation;
    }

    private static List<UnifiedEvidenceItem> restrict(List<UnifiedEvidenceItem> evidence, GatePolicy policy) {
        Set<Dimension> dimensions = EnumSet.noneOf(Dimension.class);
        for (FitType fitType : policy.requiredFitTypes()) {
            dimensions.add(EvidenceAggregator.dimensionOf(fitType));
        }
        return evidence.stream()
            .filter(item -> item != null && dimensions.contains(item.dimension()))
            .toList();
    }
}
