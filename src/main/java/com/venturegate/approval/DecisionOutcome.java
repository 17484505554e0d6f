package com.venturegate.approval;

public record DecisionOutcome(ApprovalRequest request, String message) {
}
