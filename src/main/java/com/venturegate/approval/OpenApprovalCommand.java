package com.venturegate.approval;

import java.util.List;

public record OpenApprovalCommand(
    ApprovalType approvalType,
    String ownerId,
    String projectId,
    String executionId,
    String taskId,
    String title,
    String description,
    GateSnapshot gateEvaluation,
    List<String> overrideRoles
) {
}
