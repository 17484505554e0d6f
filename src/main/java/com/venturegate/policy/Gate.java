package com.venturegate.policy;

import com.fasterxml.jackson.annotation.JsonValue;
import com.venturegate.evidence.Dimension;
import com.venturegate.evidence.FitType;

import java.util.Locale;

/**
 * Validation checkpoints a venture passes on its way forward. Path and body values are
 * matched case-insensitively.
 */
public enum Gate {
    DESIRABILITY(Dimension.DESIRABILITY, FitType.DESIRABILITY),
    FEASIBILITY(Dimension.FEASIBILITY, FitType.FEASIBILITY),
    VIABILITY(Dimension.VIABILITY, FitType.VIABILITY);

    private final Dimension dimension;
    private final FitType fitType;

    Gate(Dimension dimension, FitType fitType) {
        this.dimension = dimension;
        this.fitType = fitType;
    }

    public Dimension getDimension() {
        return dimension;
    }

    public FitType getFitType() {
        return fitType;
    }

    @JsonValue
    public String getValue() {
        return name();
    }

    public static Gate parse(String raw) {
        if (raw != null) {
            String normalized = raw.trim().toUpperCase(Locale.ROOT);
            for (Gate gate : values()) {
                if (gate.name().equals(normalized)) {
                    return gate;
                }
            }
        }
        throw new UnknownGateException(raw);
    }
}
