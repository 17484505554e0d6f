package com.venturegate.aggregation;

import com.venturegate.evidence.Dimension;
import com.venturegate.evidence.EvidenceStrength;

import java.time.Instant;

/**
 * Timeline filters. A null field means "all".
 *
 * @param contradictionsOnly keep only user evidence flagged as contradicting; automated items
 *                           are unaffected by this flag
 * @param from               inclusive lower bound on the item timestamp
 * @param to                 inclusive upper bound on the item timestamp
 * @param search             case-insensitive substring matched against the title, and for user
 *                           evidence also against content and summary
 */
public record EvidenceFilters(
    Dimension dimension,
    EvidenceOrigin source,
    EvidenceStrength strength,
    boolean contradictionsOnly,
    Instant from,
    Instant to,
    String search
) {

    public static EvidenceFilters none() {
        return new EvidenceFilters(null, null, null, false, null, null, null);
    }
}
