package com.venturegate.aggregation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.venturegate.evidence.Dimension;
import com.venturegate.evidence.EvidenceStrength;
import com.venturegate.evidence.Signal;

import java.time.Instant;
import java.util.Objects;
import java.util.function.Function;

/**
 * Evidence for one dimension of one automated validation state.
 * Automated items are never contradictions.
 */
public record AutomatedEvidenceItem(
    String id,
    Dimension dimension,
    EvidenceStrength strength,
    Instant timestamp,
    String title,
    Signal signal,
    Object evidence,
    int iteration,
    String validationStateId
) implements UnifiedEvidenceItem {

    public AutomatedEvidenceItem {
        Objects.requireNonNull(timestamp, "timestamp must be resolved before construction");
    }

    @JsonProperty("source")
    @Override
    public EvidenceOrigin source() {
        return EvidenceOrigin.AUTOMATED;
    }

    @Override
    public <R> R match(Function<? super UserEvidenceItem, ? extends R> onUser,
                       Function<? super AutomatedEvidenceItem, ? extends R> onAutomated) {
        return onAutomated.apply(this);
    }
}
