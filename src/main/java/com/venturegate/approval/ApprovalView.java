package com.venturegate.approval;

import java.util.List;

public record ApprovalView(ApprovalRequest request, ApprovalSubject subject, List<ApprovalHistoryEntry> history) {

    public ApprovalView {
        history = List.copyOf(history);
    }
}
