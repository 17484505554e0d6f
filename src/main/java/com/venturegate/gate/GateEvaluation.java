package com.venturegate.gate;

import com.venturegate.policy.Gate;

import java.util.List;

/**
 * Result of evaluating one gate. {@code reasons} lists every unmet criterion plus any
 * unverified thresholds, by stable tag.
 */
public record GateEvaluation(
    Gate gate,
    boolean pass,
    boolean needsApproval,
    List<String> reasons,
    int evidenceCount,
    int experimentCount
) {

    public GateEvaluation {
        reasons = List.copyOf(reasons);
    }
}
