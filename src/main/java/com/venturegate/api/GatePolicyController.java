package com.venturegate.api;

import com.venturegate.policy.Gate;
import com.venturegate.policy.GatePolicy;
import com.venturegate.policy.GatePolicyService;
import com.venturegate.policy.GatePolicyUpdate;
import com.venturegate.policy.GatePolicyView;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-actor gate policy settings.
 *
 * GET    /v1/settings/gate-policies
 * GET    /v1/settings/gate-policies/{gate}
 * PUT    /v1/settings/gate-policies/{gate}
 * DELETE /v1/settings/gate-policies/{gate}
 */
@RestController
@RequestMapping("/v1/settings/gate-policies")
public class GatePolicyController {

    private final GatePolicyService policyService;

    public GatePolicyController(GatePolicyService policyService) {
        this.policyService = policyService;
    }

    @GetMapping
    public List<GatePolicyView> list(@RequestHeader(name = ActorHeader.NAME, required = false) String actorId) {
        return policyService.viewAll(ActorHeader.require(actorId));
    }

    @GetMapping("/{gate}")
    public GatePolicyView get(@RequestHeader(name = ActorHeader.NAME, required = false) String actorId,
                              @PathVariable String gate) {
        return policyService.view(ActorHeader.require(actorId), Gate.parse(gate));
    }

    @PutMapping("/{gate}")
    public Map<String, Object> put(@RequestHeader(name = ActorHeader.NAME, required = false) String actorId,
                                   @PathVariable String gate,
                                   @RequestBody GatePolicyUpdate update) {
        GatePolicy saved = policyService.upsert(ActorHeader.require(actorId), Gate.parse(gate), update);
        return response(saved, "Gate policy saved successfully");
    }

    @DeleteMapping("/{gate}")
    public Map<String, Object> delete(@RequestHeader(name = ActorHeader.NAME, required = false) String actorId,
                                      @PathVariable String gate) {
        GatePolicy defaults = policyService.reset(ActorHeader.require(actorId), Gate.parse(gate));
        return response(defaults, "Gate policy reset to defaults");
    }

    private static Map<String, Object> response(GatePolicy policy, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("policy", policy);
        body.put("message", message);
        return body;
    }
}
