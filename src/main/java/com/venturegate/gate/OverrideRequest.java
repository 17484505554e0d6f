package com.venturegate.gate;

import java.util.Map;

public record OverrideRequest(String reason, Map<String, Double> metrics, String executionId, String taskId) {

    public OverrideRequest {
        metrics = metrics == null ? Map.of() : metrics;
    }
}
