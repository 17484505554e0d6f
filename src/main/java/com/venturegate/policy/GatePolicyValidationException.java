package com.venturegate.policy;

import java.util.List;

/**
 * A policy write with one or more fields outside their declared bounds. Nothing is stored.
 */
public class GatePolicyValidationException extends RuntimeException {

    private final Gate gate;
    private final List<String> violations;

    public GatePolicyValidationException(Gate gate, List<String> violations) {
        super("Invalid " + gate.name() + " gate policy: " + String.join("; ", violations));
        this.gate = gate;
        this.violations = List.copyOf(violations);
    }

    public Gate getGate() {
        return gate;
    }

    public List<String> getViolations() {
        return violations;
    }
}
