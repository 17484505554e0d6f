package com.venturegate.policy;

import com.venturegate.evidence.FitType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Per-actor gate policy customization on top of {@link GatePolicyDefaults}.
 */
@Service
public class GatePolicyService {

    private static final Logger log = LoggerFactory.getLogger(GatePolicyService.class);

    static final int MIN_EXPERIMENTS_LOWER = 1;
    static final int EVIDENCE_BOUND_UPPER = 10;

    private final GatePolicyStore store;
    private final Clock clock;

    public GatePolicyService(GatePolicyStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    /**
     * Merges {@code override} over the gate defaults one field at a time. A null override,
     * or a null field within one, means "use the default".
     */
    public static GatePolicy resolveEffective(Gate gate, GatePolicyOverride override) {
        if (override == null) {
            return GatePolicy.defaultsFor(gate);
        }
        GatePolicyDefaults defaults = GatePolicyDefaults.forGate(gate);
        return new GatePolicy(
            override.id(),
            gate,
            true,
            orDefault(override.minExperiments(), defaults.minExperiments()),
            orDefault(override.requiredFitTypes(), defaults.requiredFitTypes()),
            orDefault(override.minWeakEvidence(), defaults.minWeakEvidence()),
            orDefault(override.minMediumEvidence(), defaults.minMediumEvidence()),
            orDefault(override.minStrongEvidence(), defaults.minStrongEvidence()),
            orDefault(override.thresholds(), defaults.thresholds()),
            orDefault(override.overrideRoles(), GatePolicyDefaults.DEFAULT_OVERRIDE_ROLES),
            orDefault(override.requiresApproval(), defaults.requiresApproval())
        );
    }

    public GatePolicy effectivePolicy(String actorId, Gate gate) {
        return resolveEffective(gate, store.find(actorId, gate).orElse(null));
    }

    public GatePolicyView view(String actorId, Gate gate) {
        return new GatePolicyView(effectivePolicy(actorId, gate), GatePolicyDefaults.forGate(gate));
    }

    public List<GatePolicyView> viewAll(String actorId) {
        List<GatePolicyView> views = new ArrayList<>(Gate.values().length);
        for (Gate gate : Gate.values()) {
            views.add(view(actorId, gate));
        }
        return views;
    }

    /**
     * Validates every present field against its bounds and, if all are valid, merges them into
     * the actor's override. Out-of-range values are rejected, never clamped.
     *
     * @throws GatePolicyValidationException listing every violated bound
     */
    public GatePolicy upsert(String actorId, Gate gate, GatePolicyUpdate update) {
        List<String> violations = new ArrayList<>();
        checkRange(violations, "minExperiments", update.minExperiments(), MIN_EXPERIMENTS_LOWER, EVIDENCE_BOUND_UPPER);
        checkRange(violations, "minWeakEvidence", update.minWeakEvidence(), 0, EVIDENCE_BOUND_UPPER);
        checkRange(violations, "minMediumEvidence", update.minMediumEvidence(), 0, EVIDENCE_BOUND_UPPER);
        checkRange(violations, "minStrongEvidence", update.minStrongEvidence(), 0, EVIDENCE_BOUND_UPPER);
        List<FitType> fitTypes = parseFitTypes(violations, update.requiredFitTypes());
        checkThresholds(violations, update.thresholds());
        checkRoles(violations, update.overrideRoles());

        if (!violations.isEmpty()) {
            log.warn("Rejected {} gate policy update for actor {}: {}", gate, actorId, violations);
            throw new GatePolicyValidationException(gate, violations);
        }

        GatePolicyOverride existing = store.find(actorId, gate)
            .orElseGet(() -> GatePolicyOverride.empty(UUID.randomUUID().toString(), actorId, gate, clock.instant()));
        GatePolicyOverride saved = store.save(existing.apply(update, fitTypes, clock.instant()));
        log.info("Saved {} gate policy {} for actor {}", gate, saved.id(), actorId);
        return resolveEffective(gate, saved);
    }

    /** Drops the actor's override, if any, and returns the defaults. Idempotent. */
    public GatePolicy reset(String actorId, Gate gate) {
        if (store.delete(actorId, gate)) {
            log.info("Reset {} gate policy to defaults for actor {}", gate, actorId);
        }
        return GatePolicy.defaultsFor(gate);
    }

    private static void checkRange(List<String> violations, String field, Integer value, int min, int max) {
        if (value != null && (value < min || value > max)) {
            violations.add(field + " must be between " + min + " and " + max + " (was " + value + ")");
        }
    }

    private static List<FitType> parseFitTypes(List<String> violations, List<String> raw) {
        if (raw == null) {
            return null;
        }
        if (raw.isEmpty()) {
            violations.add("requiredFitTypes must not be empty");
            return null;
        }
        List<FitType> parsed = new ArrayList<>(raw.size());
        for (String value : raw) {
            Optional<FitType> fitType = FitType.find(value);
            if (fitType.isEmpty()) {
                violations.add("requiredFitTypes contains unknown fit type '" + value + "'");
            } else if (!parsed.contains(fitType.get())) {
                parsed.add(fitType.get());
            }
        }
        return parsed;
    }

    private static void checkThresholds(List<String> violations, Map<String, Double> thresholds) {
        if (thresholds == null) {
            return;
        }
        thresholds.forEach((key, value) -> {
            if (key == null || key.isBlank()) {
                violations.add("thresholds keys must not be blank");
            } else if (value == null || !Double.isFinite(value)) {
                violations.add("thresholds." + key + " must be a finite number");
            }
        });
    }

    private static void checkRoles(List<String> violations, List<String> roles) {
        if (roles != null && roles.stream().anyMatch(role -> role == null || role.isBlank())) {
            violations.add("overrideRoles must not contain blank roles");
        }
    }

    private static <T> T orDefault(T value, T fallback) {
        return value != null ? value : fallback;
    }
}
