package com.venturegate.gate;

import java.util.Map;

/**
 * Caller-supplied inputs to a gate evaluation. {@code executionId} and {@code taskId} name the
 * orchestrator run to resume once an approval opened by this evaluation is decided.
 */
public record GateEvaluationRequest(Map<String, Double> metrics, String executionId, String taskId) {

    public GateEvaluationRequest {
        metrics = metrics == null ? Map.of() : metrics;
    }
}
