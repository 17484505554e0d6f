package com.venturegate.approval;

public class ApprovalAccessDeniedException extends RuntimeException {

    public ApprovalAccessDeniedException(String message) {
        super(message);
    }
}
