package com.venturegate.evidence;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum DesirabilitySignal implements Signal {
    NO_SIGNAL("no_signal", "No Signal", "Not yet tested", EvidenceStrength.WEAK, 0),
    NO_INTEREST("no_interest", "No Interest", "Low traffic/signup - wrong segment?", EvidenceStrength.WEAK, 1),
    WEAK_INTEREST("weak_interest", "Weak Interest", "High CTR but low conversion - zombies detected",
        EvidenceStrength.MEDIUM, 2),
    STRONG_COMMITMENT("strong_commitment", "Strong Commitment", "Strong signup/preorder evidence",
        EvidenceStrength.STRONG, 3);

    private final String value;
    private final String label;
    private final String description;
    private final EvidenceStrength strength;
    private final double trendValue;

    DesirabilitySignal(String value, String label, String description, EvidenceStrength strength, double trendValue) {
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
        return Dimension.DESIRABILITY;
    }

    @Override
    public boolean isNeutral() {
        return this == NO_SIGNAL;
    }

    @Override
    public EvidenceStrength strength() {
        return strength;
    }

    @Override
    public double trendValue() {
        return trendValue;
    }

    public static Optional<DesirabilitySignal> find(String raw) {
        return Arrays.stream(values()).filter(v -> v.value.equals(raw)).findFirst();
    }

    @JsonCreator
    public static DesirabilitySignal fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return find(raw).orElseThrow(() -> new IllegalArgumentException("Unknown desirability signal: " + raw));
    }
}
