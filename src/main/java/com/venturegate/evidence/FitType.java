package com.venturegate.evidence;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Fit type as authored on user evidence and as listed in a gate policy's required fit types.
 */
public enum FitType {
    DESIRABILITY("Desirability"),
    FEASIBILITY("Feasibility"),
    VIABILITY("Viability");

    private final String value;

    FitType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static Optional<FitType> find(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst();
    }

    @JsonCreator
    public static FitType fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return find(raw).orElseThrow(() -> new IllegalArgumentException("Unknown fit type: " + raw));
    }
}
