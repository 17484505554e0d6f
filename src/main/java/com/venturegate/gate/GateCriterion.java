package com.venturegate.gate;

import com.venturegate.aggregation.UnifiedEvidenceItem;
import com.venturegate.policy.GatePolicy;

import java.util.List;
import java.util.Map;

/**
 * One deterministic check a gate evaluation is made of. Criteria see only the evidence
 * already restricted to the policy's required fit types.
 */
public interface GateCriterion {

    /** Stable identifier, e.g. "experiment-count". */
    String criterionId();

    /**
     * @return one outcome per check this criterion performs; never null, never throws
     */
    List<Outcome> evaluate(List<UnifiedEvidenceItem> evidence, GatePolicy policy, Map<String, Double> metrics);

    /**
     * Outcome of a single check. Only {@link Unmet} fails the gate; {@link Unverified} is reported
     * but does not count against it.
     */
    sealed interface Outcome {
        record Met() implements Outcome {}
        record Unmet(String reason) implements Outcome {}
        record Unverified(String reason) implements Outcome {}
    }
}
