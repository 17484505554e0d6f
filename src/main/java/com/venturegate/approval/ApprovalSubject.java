package com.venturegate.approval;

public record ApprovalSubject(String projectId, String executionId, String taskId) {

    public static ApprovalSubject of(ApprovalRequest request) {
        return new ApprovalSubject(request.projectId(), request.executionId(), request.taskId());
    }
}
