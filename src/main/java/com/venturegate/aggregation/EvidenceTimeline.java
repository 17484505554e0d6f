package com.venturegate.aggregation;

import java.util.List;

/**
 * @param summary         counts over the project's whole timeline
 * @param filteredSummary counts over {@code items} only
 */
public record EvidenceTimeline(List<UnifiedEvidenceItem> items, EvidenceSummary summary,
                               EvidenceSummary filteredSummary) {

    public EvidenceTimeline {
        items = List.copyOf(items);
    }
}
