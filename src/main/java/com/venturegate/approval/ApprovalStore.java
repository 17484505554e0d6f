package com.venturegate.approval;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for approval requests and their history.
 */
public interface ApprovalStore {

    ApprovalRequest insert(ApprovalRequest request);

    Optional<ApprovalRequest> findById(String id);

    /** Newest first; a null status returns every request. */
    List<ApprovalRequest> findAll(ApprovalStatus status);

    /**
     * Atomically moves the request to {@code status} only if it is still pending, and appends
     * {@code decisionEntry} to its history in the same unit of work. Either both are written or
     * neither is.
     *
     * @return false if the request was missing or already decided; nothing is written in that case
     * @throws ApprovalStoreException if either write fails; the request is then still pending
     */
    boolean decideIfPending(String id, ApprovalStatus status, String decision, String feedback,
                            String decidedBy, Instant decidedAt, ApprovalHistoryEntry decisionEntry);

    void appendHistory(ApprovalHistoryEntry entry);

    /** Oldest first. */
    List<ApprovalHistoryEntry> history(String approvalId);
}
