package com.venturegate.policy;

import java.util.Optional;

public interface GatePolicyStore {

    Optional<GatePolicyOverride> find(String actorId, Gate gate);

    GatePolicyOverride save(GatePolicyOverride override);

    /** @return true if an override existed and was removed */
    boolean delete(String actorId, Gate gate);
}
