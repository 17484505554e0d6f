package com.venturegate.approval;

import java.time.Instant;
import java.util.Map;

/**
 * One immutable audit record. Entries are only ever appended.
 */
public record ApprovalHistoryEntry(
    String approvalId,
    String actorId,
    ActorType actorType,
    String action,
    Map<String, Object> details,
    Instant timestamp
) {

    public static final String CREATED = "created";
    public static final String VIEWED = "viewed";

    public ApprovalHistoryEntry {
        details = details == null ? Map.of() : Map.copyOf(details);
    }
}
