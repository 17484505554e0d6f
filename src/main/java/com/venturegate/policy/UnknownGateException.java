package com.venturegate.policy;

import java.util.Arrays;
import java.util.stream.Collectors;

public class UnknownGateException extends RuntimeException {

    private final String gate;

    public UnknownGateException(String gate) {
        super("Invalid gate '" + gate + "'. Must be one of: "
            + Arrays.stream(Gate.values()).map(Gate::name).collect(Collectors.joining(", ")));
        this.gate = gate;
    }

    public String getGate() {
        return gate;
    }
}
