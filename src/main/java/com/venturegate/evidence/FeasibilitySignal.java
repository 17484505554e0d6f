package com.venturegate.evidence;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum FeasibilitySignal implements Signal {
    UNKNOWN("unknown", "Unknown", "Not yet assessed", EvidenceStrength.WEAK, 0),
    GREEN("green", "Green", "Feasible with current resources", EvidenceStrength.STRONG, 3),
    ORANGE_CONSTRAINED("orange_constrained", "Constrained", "Feasible only with scope reduction",
        EvidenceStrength.MEDIUM, 2),
    RED_IMPOSSIBLE("red_impossible", "Impossible", "Cannot build with available resources",
        EvidenceStrength.WEAK, 1);

    private final String value;
    private final String label;
    private final String description;
    private final EvidenceStrength strength;
    private final double trendValue;

    FeasibilitySignal(String value, String label, String description, EvidenceStrength strength, double trendValue) {
        this.value = value;
        this.label = label;
        this.description = description;
        this.strength = strength;
        this.trendValue = trendValue;
    }

    @JsonValue
    @Override
    public String getValue() {
        return value;
    }

    @Override
    public String getLabel() {
        return label;
    }

    @Override
    public String getDescription() {
        return description;
    }

    @Override
    public Dimension dimension() {
        return Dimension.FEASIBILITY;
    }

    @Override
    public boolean isNeutral() {
        return this == UNKNOWN;
    }

    @Override
    public EvidenceStrength strength() {
        return strength;
    }

    @Override
    public double trendValue() {
        return trendValue;
    }

    public static Optional<FeasibilitySignal> find(String raw) {
        return Arrays.stream(values()).filter(v -> v.value.equals(raw)).findFirst();
    }

    @JsonCreator
    public static FeasibilitySignal fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return find(raw).orElseThrow(() -> new IllegalArgumentException("Unknown feasibility signal: " + raw));
    }
}
