package com.venturegate.policy;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class InMemoryGatePolicyStore implements GatePolicyStore {

    private final Map<Key, GatePolicyOverride> overrides = new ConcurrentHashMap<>();

    @Override
    public Optional<GatePolicyOverride> find(String actorId, Gate gate) {
        return Optional.ofNullable(overrides.get(new Key(actorId, gate)));
    }

    @Override
    public GatePolicyOverride save(GatePolicyOverride override) {
        overrides.put(new Key(override.actorId(), override.gate()), override);
        return override;
    }

    @Override
    public boolean delete(String actorId, Gate gate) {
        return overrides.remove(new Key(actorId, gate)) != null;
    }

    private record Key(String actorId, Gate gate) {}
}
