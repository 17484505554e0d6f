package com.venturegate.approval;

import java.time.Instant;
import java.util.List;

/**
 * A human-in-the-loop decision point. {@code executionId}/{@code taskId} identify the paused
 * orchestrator run and checkpoint; both may be null for requests not tied to a run.
 * The decision fields are null while pending and immutable once set.
 */
public record ApprovalRequest(
    String id,
    ApprovalType approvalType,
    String ownerId,
    String projectId,
    String executionId,
    String taskId,
    String title,
    String description,
    ApprovalStatus status,
    GateSnapshot gateEvaluation,
    List<String> overrideRoles,
    String decision,
    String feedback,
    String decidedBy,
    Instant createdAt,
    Instant decidedAt
) {

    public ApprovalRequest {
        overrideRoles = overrideRoles == null ? List.of() : List.copyOf(overrideRoles);
    }

    ApprovalRequest decided(ApprovalStatus newStatus, String newDecision, String newFeedback,
                            String actorId, Instant at) {
        return new ApprovalRequest(id, approvalType, ownerId, projectId, executionId, taskId, title, description,
            newStatus, gateEvaluation, overrideRoles, newDecision, newFeedback, actorId, createdAt, at);
    }
}
