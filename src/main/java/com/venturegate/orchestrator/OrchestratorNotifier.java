package com.venturegate.orchestrator;

public interface OrchestratorNotifier {

    /**
     * Tells the orchestrator a paused run may resume.
     *
     * @throws OrchestratorNotificationException if the call fails or is refused
     */
    void notifyResume(ResumeNotification notification);
}
