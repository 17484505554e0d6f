package com.venturegate.evidence;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum EvidenceStrength {
    WEAK("weak"),
    MEDIUM("medium"),
    STRONG("strong");

    private final String value;

    EvidenceStrength(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static Optional<EvidenceStrength> find(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equals(raw))
            .findFirst();
    }

    @JsonCreator
    public static EvidenceStrength fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return find(raw.toLowerCase()).orElseThrow(() -> new IllegalArgumentException("Unknown strength: " + raw));
    }
}
