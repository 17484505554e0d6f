package com.venturegate.orchestrator;

public class OrchestratorNotificationException extends RuntimeException {

    public OrchestratorNotificationException(String message) {
        super(message);
    }

    public OrchestratorNotificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
