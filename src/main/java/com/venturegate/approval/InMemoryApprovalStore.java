package com.venturegate.approval;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

public class InMemoryApprovalStore implements ApprovalStore {

    private final Map<String, ApprovalRequest> requests = new ConcurrentHashMap<>();
    private final Map<String, List<ApprovalHistoryEntry>> history = new ConcurrentHashMap<>();

    @Override
    public ApprovalRequest insert(ApprovalRequest request) {
        if (requests.putIfAbsent(request.id(), request) != null) {
            throw new IllegalArgumentException("Approval request already exists: " + request.id());
        }
        return request;
    }

    @Override
    public Optional<ApprovalRequest> findById(String id) {
        return Optional.ofNullable(requests.get(id));
    }

    @Override
    public List<ApprovalRequest> findAll(ApprovalStatus status) {
        List<ApprovalRequest> matching = new ArrayList<>();
        for (ApprovalRequest request : requests.values()) {
            if (status == null || request.status() == status) {
                matching.add(request);
            }
        }
        matching.sort(Comparator.comparing(ApprovalRequest::createdAt).reversed());
        return matching;
    }

    @Override
    public boolean decideIfPending(String id, ApprovalStatus status, String decision, String feedback,
                                   String decidedBy, Instant decidedAt, ApprovalHistoryEntry decisionEntry) {
        AtomicBoolean applied = new AtomicBoolean(false);
        requests.computeIfPresent(id, (key, current) -> {
            if (current.status() != ApprovalStatus.PENDING) {
                return current;
            }
            ApprovalRequest decided = current.decided(status, decision, feedback, decidedBy, decidedAt);
            // Runs under the entry's lock, so a failed append leaves the request pending.
            appendHistory(decisionEntry);
            applied.set(true);
            return decided;
        });
        return applied.get();
    }

    @Override
    public void appendHistory(ApprovalHistoryEntry entry) {
        history.computeIfAbsent(entry.approvalId(), key -> new CopyOnWriteArrayList<>()).add(entry);
    }

    @Override
    public List<ApprovalHistoryEntry> history(String approvalId) {
        return List.copyOf(history.getOrDefault(approvalId, List.of()));
    }
}
