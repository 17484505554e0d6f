package com.venturegate.approval;

public class ApprovalStoreException extends RuntimeException {

    public ApprovalStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
