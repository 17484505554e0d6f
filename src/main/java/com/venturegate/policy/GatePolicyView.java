package com.venturegate.policy;

public record GatePolicyView(GatePolicy policy, GatePolicyDefaults defaults) {
}
