package com.venturegate.approval;

/**
 * Body of a decide call. {@code decision} is an optional label (e.g. {@code iterate}) passed
 * through to the orchestrator; when absent the action itself is the label.
 */
public record DecisionRequest(String action, String decision, String feedback) {
}
