package com.venturegate.evidence;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum EvidenceCategory {
    SURVEY("Survey"),
    INTERVIEW("Interview"),
    EXPERIMENT("Experiment"),
    ANALYTICS("Analytics"),
    RESEARCH("Research");

    private final String value;

    EvidenceCategory(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static Optional<EvidenceCategory> find(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equals(raw))
            .findFirst();
    }
}
