package com.venturegate.evidence;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * The three validation dimensions every evidence item is attributed to.
 */
public enum Dimension {
    DESIRABILITY("desirability", "Desirability"),
    FEASIBILITY("feasibility", "Feasibility"),
    VIABILITY("viability", "Viability");

    private final String value;
    private final String label;

    Dimension(String value, String label) {
        this.value = value;
        this.label = label;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getLabel() {
        return label;
    }

    @JsonCreator
    public static Dimension fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown dimension: " + raw));
    }
}
