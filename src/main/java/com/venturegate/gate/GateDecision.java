package com.venturegate.gate;

import com.venturegate.approval.ApprovalRequest;
import com.venturegate.policy.GatePolicy;

/**
 * @param approvalRequest the request opened for this evaluation, or null if none was needed
 */
public record GateDecision(GateEvaluation evaluation, GatePolicy policy, ApprovalRequest approvalRequest) {
}
