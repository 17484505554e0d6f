package com.venturegate.approval;

import java.util.Locale;

/**
 * What a reviewer does with a pending request, and the terminal status it leads to.
 */
public enum ApprovalAction {
    APPROVE("approve", ApprovalStatus.APPROVED),
    REJECT("reject", ApprovalStatus.REJECTED);

    private final String value;
    private final ApprovalStatus resultingStatus;

    ApprovalAction(String value, ApprovalStatus resultingStatus) {
        this.value = value;
        this.resultingStatus = resultingStatus;
    }

    public String getValue() {
        return value;
    }

    public ApprovalStatus getResultingStatus() {
        return resultingStatus;
    }

    public static ApprovalAction parse(String raw) {
        if (raw != null) {
            String normalized = raw.trim().toLowerCase(Locale.ROOT);
            for (ApprovalAction action : values()) {
                if (action.value.equals(normalized)) {
                    return action;
                }
            }
        }
        throw new InvalidDecisionException("action must be 'approve' or 'reject' (was " + raw + ")");
    }
}
