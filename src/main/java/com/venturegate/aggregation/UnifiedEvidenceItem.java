package com.venturegate.aggregation;

import com.venturegate.evidence.Dimension;
import com.venturegate.evidence.EvidenceStrength;

import java.time.Instant;
import java.util.function.Function;

/**
 * One entry of the unified evidence timeline: either user-authored or derived from an
 * automated validation state. Consumers branch with {@link #match}, which forces a case for
 * each permitted record.
 */
public sealed interface UnifiedEvidenceItem permits UserEvidenceItem, AutomatedEvidenceItem {

    String id();

    Dimension dimension();

    EvidenceStrength strength();

    /** Never null. */
    Instant timestamp();

    String title();

    EvidenceOrigin source();

    <R> R match(Function<? super UserEvidenceItem, ? extends R> onUser,
                Function<? super AutomatedEvidenceItem, ? extends R> onAutomated);
}
