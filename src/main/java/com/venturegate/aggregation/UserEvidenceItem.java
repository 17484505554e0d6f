package com.venturegate.aggregation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.venturegate.evidence.Dimension;
import com.venturegate.evidence.Evidence;
import com.venturegate.evidence.EvidenceCategory;
import com.venturegate.evidence.EvidenceStrength;

import java.time.Instant;
import java.util.Objects;
import java.util.function.Function;

public record UserEvidenceItem(
    String id,
    Dimension dimension,
    EvidenceStrength strength,
    Instant timestamp,
    String title,
    boolean contradiction,
    EvidenceCategory category,
    Evidence data
) implements UnifiedEvidenceItem {

    public UserEvidenceItem {
        Objects.requireNonNull(timestamp, "timestamp must be resolved before construction");
    }

    @JsonProperty("source")
    @Override
    public EvidenceOrigin source() {
        return EvidenceOrigin.USER;
    }

    @Override
    public <R> R match(Function<? super UserEvidenceItem, ? extends R> onUser,
                       Function<? super AutomatedEvidenceItem, ? extends R> onAutomated) {
        return onUser.apply(this);
    }
}
