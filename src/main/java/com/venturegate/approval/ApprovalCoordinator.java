package com.venturegate.approval;

import com.venturegate.orchestrator.OrchestratorNotifier;
import com.venturegate.orchestrator.ResumeNotification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Opens, shows and decides approval requests.
 * <p>
 * A decision and its history entry are recorded together through
 * {@link ApprovalStore#decideIfPending}; only the caller that wins that compare-and-set resumes the
 * orchestrator, so each request notifies at most once. Notification failures are logged and never undo the decision.
 */
@Service
public class ApprovalCoordinator {

    private static final Logger log = LoggerFactory.getLogger(ApprovalCoordinator.class);

    static final String SYSTEM_ACTOR = "system";

    private final ApprovalStore store;
    private final ActorDirectory actors;
    private final OrchestratorNotifier notifier;
    private final Clock clock;

    public ApprovalCoordinator(ApprovalStore store, ActorDirectory actors, OrchestratorNotifier notifier,
                               Clock clock) {
        this.store = store;
        this.actors = actors;
        this.notifier = notifier;
        this.clock = clock;
    }

    public ApprovalRequest open(OpenApprovalCommand command) {
        Instant now = clock.instant();
        ApprovalRequest request = store.insert(new ApprovalRequest(
            UUID.randomUUID().toString(),
            command.approvalType(),
            command.ownerId(),
            command.projectId(),
            command.executionId(),
            command.taskId(),
            command.title(),
            command.description(),
            ApprovalStatus.PENDING,
            command.gateEvaluation(),
            command.overrideRoles(),
            null, null, null,
            now,
            null
        ));

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("approvalType", request.approvalType().getValue());
        if (request.gateEvaluation() != null) {
            details.put("gate", request.gateEvaluation().gate().name());
            details.put("automaticPass", request.gateEvaluation().automaticPass());
        }
        store.appendHistory(new ApprovalHistoryEntry(request.id(), SYSTEM_ACTOR, ActorType.SYSTEM,
            ApprovalHistoryEntry.CREATED, details, now));

        log.info("Opened {} approval request {} for owner {} on project {}",
            request.approvalType().getValue(), request.id(), request.ownerId(), request.projectId());
        return request;
    }

    /** Returns the request with its subject and history, recording the view. */
    public ApprovalView view(String approvalId, String actorId) {
        ApprovalRequest request = load(approvalId);
        checkAccess(request, actorId);
        store.appendHistory(new ApprovalHistoryEntry(approvalId, actorId, ActorType.USER,
            ApprovalHistoryEntry.VIEWED, Map.of(), clock.instant()));
        return new ApprovalView(request, ApprovalSubject.of(request), store.history(approvalId));
    }

    public List<ApprovalRequest> list(String actorId, ApprovalStatus status) {
        return store.findAll(status).stream()
            .filter(request -> actors.canReview(actorId, request.ownerId()))
            .toList();
    }

    /**
     * Applies an approve or reject decision.
     *
     * @throws InvalidDecisionException if the action is neither approve nor reject
     * @throws ApprovalNotFoundException if no such request exists
     * @throws ApprovalAccessDeniedException if the actor may not decide it, or approves a failing
     *         gate without one of the request's override roles
     * @throws ApprovalConflictException if the request is no longer pending
     */
    public DecisionOutcome decide(String approvalId, String actorId, DecisionRequest decisionRequest) {
        ApprovalAction action = ApprovalAction.parse(decisionRequest.action());
        ApprovalRequest request = load(approvalId);
        checkAccess(request, actorId);

        if (request.status().isTerminal()) {
            log.warn("Rejected {} on approval request {} by {}: already {}",
                action.getValue(), approvalId, actorId, request.status().getValue());
            throw new ApprovalConflictException(approvalId, request.status());
        }

        boolean override = action == ApprovalAction.APPROVE && isFailingGate(request);
        if (override && !actors.hasAnyRole(actorId, request.overrideRoles())) {
            throw new ApprovalAccessDeniedException("Approving a failing gate requires one of the roles "
                + request.overrideRoles());
        }

        String label = decisionRequest.decision() != null && !decisionRequest.decision().isBlank()
            ? decisionRequest.decision()
            : action.getValue();
        String decision = DecisionVocabulary.toOrchestrator(label);
        Instant now = clock.instant();

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("decision", decision);
        if (decisionRequest.feedback() != null) {
            details.put("feedback", decisionRequest.feedback());
        }
        if (override) {
            details.put("override", true);
        }
        ApprovalHistoryEntry entry = new ApprovalHistoryEntry(approvalId, actorId, ActorType.USER,
            action.getResultingStatus().getValue(), details, now);

        if (!store.decideIfPending(approvalId, action.getResultingStatus(), decision,
                decisionRequest.feedback(), actorId, now, entry)) {
            ApprovalStatus current = store.findById(approvalId).map(ApprovalRequest::status).orElse(null);
            log.warn("Lost concurrent decision on approval request {} by {}; status is now {}",
                approvalId, actorId, current);
            throw new ApprovalConflictException(approvalId, current);
        }

        ApprovalRequest decided = load(approvalId);
        log.info("Approval request {} {} by {} with decision {}{}", approvalId,
            decided.status().getValue(), actorId, decision, override ? " (override)" : "");

        resumeOrchestrator(decided);
        return new DecisionOutcome(decided, "Request " + decided.status().getValue() + " successfully");
    }

    private void resumeOrchestrator(ApprovalRequest decided) {
        if (decided.executionId() == null || decided.executionId().isBlank()) {
            log.debug("Approval request {} has no orchestrator run; nothing to resume", decided.id());
            return;
        }
        try {
            notifier.notifyResume(new ResumeNotification(
                decided.executionId(),
                decided.taskId(),
                decided.decision(),
                decided.feedback(),
                decided.decidedBy()
            ));
        } catch (RuntimeException e) {
            log.warn("Failed to resume orchestrator run {} for approval request {}; decision {} stays recorded",
                decided.executionId(), decided.id(), decided.decision(), e);
        }
    }

    private static boolean isFailingGate(ApprovalRequest request) {
        return request.gateEvaluation() != null && !request.gateEvaluation().automaticPass();
    }

    private ApprovalRequest load(String approvalId) {
        return store.findById(approvalId).orElseThrow(() -> new ApprovalNotFoundException(approvalId));
    }

    private void checkAccess(ApprovalRequest request, String actorId) {
        if (!actors.canReview(actorId, request.ownerId())) {
            log.warn("Actor {} denied access to approval request {}", actorId, request.id());
            throw new ApprovalAccessDeniedException("Actor " + actorId + " may not access approval request "
                + request.id());
        }
    }
}
