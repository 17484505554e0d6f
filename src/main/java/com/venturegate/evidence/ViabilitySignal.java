package com.venturegate.evidence;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum ViabilitySignal implements Signal {
    UNKNOWN("unknown", "Unknown", "Not yet assessed", EvidenceStrength.WEAK, 0),
    PROFITABLE("profitable", "Profitable", "LTV/CAC >= 3 with healthy margins", EvidenceStrength.STRONG, 3),
    MARGINAL("marginal", "Marginal", "LTV/CAC between 1-3, needs optimization", EvidenceStrength.MEDIUM, 2),
    UNDERWATER("underwater", "Underwater", "CAC > LTV, bleeding money", EvidenceStrength.WEAK, 1),
    ZOMBIE_MARKET("zombie_market", "Zombie Market", "Unit economics work but TAM too small",
        EvidenceStrength.WEAK, 1.5);

    private final String value;
    private final String label;
    private final String description;
    private final EvidenceStrength strength;
    private final double trendValue;

    ViabilitySignal(String value, String label, String description, EvidenceStrength strength, double trendValue) {
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
        return Dimension.VIABILITY;
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

    public static Optional<ViabilitySignal> find(String raw) {
        return Arrays.stream(values()).filter(v -> v.value.equals(raw)).findFirst();
    }

    @JsonCreator
    public static ViabilitySignal fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return find(raw).orElseThrow(() -> new IllegalArgumentException("Unknown viability signal: " + raw));
    }
}
