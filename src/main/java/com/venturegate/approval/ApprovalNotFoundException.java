package com.venturegate.approval;

public class ApprovalNotFoundException extends RuntimeException {

    public ApprovalNotFoundException(String approvalId) {
        super("Approval request not found: " + approvalId);
    }
}
