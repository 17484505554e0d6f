package com.venturegate.api;

import com.venturegate.aggregation.EvidenceFilters;
import com.venturegate.aggregation.EvidenceOrigin;
import com.venturegate.aggregation.EvidenceTimeline;
import com.venturegate.aggregation.ProjectEvidenceService;
import com.venturegate.aggregation.TrendPoint;
import com.venturegate.evidence.Dimension;
import com.venturegate.evidence.EvidenceStrength;
import com.venturegate.gate.GateDecision;
import com.venturegate.gate.GateEvaluationRequest;
import com.venturegate.gate.GateProgressionService;
import com.venturegate.gate.OverrideRequest;
import com.venturegate.policy.Gate;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;

/**
 * Evidence explorer and gate evaluation for one project.
 *
 * GET  /v1/projects/{projectId}/evidence
 * GET  /v1/projects/{projectId}/evidence/trend
 * POST /v1/projects/{projectId}/gates/{gate}/evaluations
 * POST /v1/projects/{projectId}/gates/{gate}/override-requests
 */
@RestController
@RequestMapping("/v1/projects/{projectId}")
public class ProjectEvidenceController {

    private final ProjectEvidenceService evidenceService;
    private final GateProgressionService progressionService;

    public ProjectEvidenceController(ProjectEvidenceService evidenceService,
                                     GateProgressionService progressionService) {
        this.evidenceService = evidenceService;
        this.progressionService = progressionService;
    }

    @GetMapping("/evidence")
    public EvidenceTimeline evidence(
            @PathVariable String projectId,
            @RequestParam(required = false) String dimension,
            @RequestParam(required = false) String source,
            @RequestParam(required = false) String strength,
            @RequestParam(defaultValue = "false") boolean contradictionsOnly,
            @RequestParam(required = false) Instant from,
            @RequestParam(required = false) Instant to,
            @RequestParam(required = false) String search) {
        EvidenceFilters filters = new EvidenceFilters(
            Dimension.fromValue(unlessAll(dimension)),
            EvidenceOrigin.fromValue(unlessAll(source)),
            EvidenceStrength.fromValue(unlessAll(strength)),
            contradictionsOnly,
            from,
            to,
            search
        );
        return evidenceService.timeline(projectId, filters);
    }

    @GetMapping("/evidence/trend")
    public List<TrendPoint> trend(@PathVariable String projectId) {
        return evidenceService.trend(projectId);
    }

    @PostMapping("/gates/{gate}/evaluations")
    public GateDecision evaluate(@RequestHeader(name = ActorHeader.NAME, required = false) String actorId,
                                 @PathVariable String projectId,
                                 @PathVariable String gate,
                                 @RequestBody(required = false) GateEvaluationRequest request) {
        GateEvaluationRequest body = request != null ? request : new GateEvaluationRequest(null, null, null);
        return progressionService.evaluate(projectId, Gate.parse(gate), ActorHeader.require(actorId), body);
    }

    @PostMapping("/gates/{gate}/override-requests")
    public GateDecision requestOverride(@RequestHeader(name = ActorHeader.NAME, required = false) String actorId,
                                        @PathVariable String projectId,
                                        @PathVariable String gate,
                                        @RequestBody(required = false) OverrideRequest request) {
        OverrideRequest body = request != null ? request : new OverrideRequest(null, null, null, null);
        return progressionService.requestOverride(projectId, Gate.parse(gate), ActorHeader.require(actorId), body);
    }

    /** Filter values arrive as "all" when the reader has not narrowed that facet. */
    private static String unlessAll(String value) {
        return value == null || value.isBlank() || "all".equalsIgnoreCase(value) ? null : value;
    }
}
