package com.venturegate.approval;

/**
 * The request was no longer pending when the decision was applied. The stored decision stands.
 */
public class ApprovalConflictException extends RuntimeException {

    private final String approvalId;
    private final ApprovalStatus currentStatus;

    public ApprovalConflictException(String approvalId, ApprovalStatus currentStatus) {
        super("Approval request " + approvalId + " has already been decided (status: "
            + (currentStatus == null ? "unknown" : currentStatus.getValue()) + ")");
        this.approvalId = approvalId;
        this.currentStatus = currentStatus;
    }

    public String getApprovalId() {
        return approvalId;
    }

    public ApprovalStatus getCurrentStatus() {
        return currentStatus;
    }
}
