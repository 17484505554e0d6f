package com.venturegate.api;

import com.venturegate.approval.ApprovalCoordinator;
import com.venturegate.approval.ApprovalRequest;
import com.venturegate.approval.ApprovalStatus;
import com.venturegate.approval.ApprovalView;
import com.venturegate.approval.DecisionOutcome;
import com.venturegate.approval.DecisionRequest;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Human-in-the-loop approval requests.
 *
 * GET   /v1/approvals?status=pending
 * GET   /v1/approvals/{id}
 * PATCH /v1/approvals/{id}   body: {"action": "approve|reject", "decision": "...", "feedback": "..."}
 */
@RestController
@RequestMapping("/v1/approvals")
public class ApprovalController {

    private final ApprovalCoordinator coordinator;

    public ApprovalController(ApprovalCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @GetMapping
    public List<ApprovalRequest> list(@RequestHeader(name = ActorHeader.NAME, required = false) String actorId,
                                      @RequestParam(required = false) String status) {
        return coordinator.list(ActorHeader.require(actorId), ApprovalStatus.fromValue(status));
    }

    @GetMapping("/{id}")
    public ApprovalView get(@RequestHeader(name = ActorHeader.NAME, required = false) String actorId,
                            @PathVariable String id) {
        return coordinator.view(id, ActorHeader.require(actorId));
    }

    @PatchMapping("/{id}")
    public DecisionOutcome decide(@RequestHeader(name = ActorHeader.NAME, required = false) String actorId,
                                  @PathVariable String id,
                                  @RequestBody DecisionRequest decision) {
        return coordinator.decide(id, ActorHeader.require(actorId), decision);
    }
}
