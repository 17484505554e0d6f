package com.venturegate.approval;

import com.venturegate.policy.Gate;

import java.util.List;

/**
 * The gate outcome a request was opened for, frozen at that moment.
 */
public record GateSnapshot(Gate gate, boolean automaticPass, List<String> reasons) {

    public GateSnapshot {
        reasons = List.copyOf(reasons);
    }
}
