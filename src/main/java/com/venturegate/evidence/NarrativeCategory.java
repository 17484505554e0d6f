package com.venturegate.evidence;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * How directly a piece of evidence observes customer behaviour: what they DO versus what they SAY.
 */
public enum NarrativeCategory {
    DO_DIRECT("DO-direct"),
    DO_INDIRECT("DO-indirect"),
    SAY("SAY");

    private final String value;

    NarrativeCategory(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static Optional<NarrativeCategory> find(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equals(raw))
            .findFirst();
    }
}
