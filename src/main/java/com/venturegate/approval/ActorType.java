package com.venturegate.approval;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum ActorType {
    USER("user"),
    SYSTEM("system");

    private final String value;

    ActorType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static ActorType fromValue(String raw) {
        return Arrays.stream(values())
            .filter(v -> v.value.equals(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown actor type: " + raw));
    }
}
