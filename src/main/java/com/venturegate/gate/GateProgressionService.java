package com.venturegate.gate;

import com.venturegate.aggregation.ProjectEvidenceService;
import com.venturegate.aggregation.UnifiedEvidenceItem;
import com.venturegate.approval.ApprovalCoordinator;
import com.venturegate.approval.ApprovalRequest;
import com.venturegate.approval.ApprovalType;
import com.venturegate.approval.GateSnapshot;
import com.venturegate.approval.OpenApprovalCommand;
import com.venturegate.boundary.BoundaryParseMemo;
import com.venturegate.policy.Gate;
import com.venturegate.policy.GatePolicy;
import com.venturegate.policy.GatePolicyService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Evaluates a project's gate under the actor's effective policy and opens the approval request
 * the outcome calls for. Overrides are never implicit: a failing gate only moves forward through
 * an approval decided by a holder of one of the policy's override roles.
 */
@Service
public class GateProgressionService {

    private static final Logger log = LoggerFactory.getLogger(GateProgressionService.class);

    private final ProjectEvidenceService evidenceService;
    private final GatePolicyService policyService;
    private final GateEvaluator evaluator;
    private final ApprovalCoordinator approvals;

    public GateProgressionService(ProjectEvidenceService evidenceService, GatePolicyService policyService,
                                  GateEvaluator evaluator, ApprovalCoordinator approvals) {
        this.evidenceService = evidenceService;
        this.policyService = policyService;
        this.evaluator = evaluator;
        this.approvals = approvals;
    }

    /** Evaluates the gate and, when the policy requires sign-off, opens a gate progression request. */
    public GateDecision evaluate(String projectId, Gate gate, String actorId, GateEvaluationRequest request) {
        GatePolicy policy = policyService.effectivePolicy(actorId, gate);
        GateEvaluation evaluation = evaluate(projectId, policy, request.metrics());
        if (!evaluation.needsApproval()) {
            return new GateDecision(evaluation, policy, null);
        }
        ApprovalRequest approval = approvals.open(new OpenApprovalCommand(
            ApprovalType.GATE_PROGRESSION,
            actorId,
            projectId,
            request.executionId(),
            request.taskId(),
            gate.getDimension().getLabel() + " gate progression",
            describe(evaluation),
            snapshot(evaluation),
            policy.overrideRoles()
        ));
        return new GateDecision(evaluation, policy, approval);
    }

    /**
     * Opens an explicit override request for a gate that does not pass on its own.
     *
     * @throws IllegalArgumentException if the gate already passes
     */
    public GateDecision requestOverride(String projectId, Gate gate, String actorId, OverrideRequest request) {
        GatePolicy policy = policyService.effectivePolicy(actorId, gate);
        GateEvaluation evaluation = evaluate(projectId, policy, request.metrics());
        if (evaluation.pass()) {
            throw new IllegalArgumentException(gate.name() + " gate already passes; no override is needed");
        }
        String description = request.reason() != null && !request.reason().isBlank()
            ? request.reason()
            : describe(evaluation);
        ApprovalRequest approval = approvals.open(new OpenApprovalCommand(
            ApprovalType.GATE_OVERRIDE,
            actorId,
            projectId,
            request.executionId(),
            request.taskId(),
            gate.getDimension().getLabel() + " gate override",
            description,
            snapshot(evaluation),
            policy.overrideRoles()
        ));
        log.info("Override requested for {} gate on project {} by {} (reasons {})",
            gate, projectId, actorId, evaluation.reasons());
        return new GateDecision(evaluation, policy, approval);
    }

    private GateEvaluation evaluate(String projectId, GatePolicy policy, Map<String, Double> metrics) {
        List<UnifiedEvidenceItem> evidence = evidenceService.unifiedEvidence(projectId, BoundaryParseMemo.create());
        return evaluator.evaluate(evidence, policy, metrics);
    }

    private static GateSnapshot snapshot(GateEvaluation evaluation) {
        return new GateSnapshot(evaluation.gate(), evaluation.pass(), evaluation.reasons());
    }

    private static String describe(GateEvaluation evaluation) {
        if (evaluation.pass()) {
            return "All automatic criteria met; human sign-off required.";
        }
        return "Automatic criteria not met: " + String.join(", ", evaluation.reasons());
    }
}
