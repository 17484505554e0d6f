package com.venturegate.approval;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum ApprovalType {
    /** Opened by a gate evaluation whose policy requires human sign-off. */
    GATE_PROGRESSION("gate_progression"),
    /** Opened explicitly to push a failing gate through. */
    GATE_OVERRIDE("gate_override");

    private final String value;

    ApprovalType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static ApprovalType fromValue(String raw) {
        return Arrays.stream(values())
            .filter(v -> v.value.equals(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown approval type: " + raw));
    }
}
