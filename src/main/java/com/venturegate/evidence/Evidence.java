package com.venturegate.evidence;

import java.time.Instant;
import java.util.List;

/**
 * User-authored evidence in its normalized form.
 * <p>
 * {@code createdAt} and {@code updatedAt} are never null here; the boundary validator
 * substitutes the current instant for missing or unparseable source timestamps.
 */
public record Evidence(
    String id,
    String projectId,
    String title,
    EvidenceCategory category,
    String summary,
    String fullText,
    String content,
    EvidenceStrength strength,
    boolean contradiction,
    FitType fitType,
    String sourceType,
    String sourceUrl,
    String author,
    String evidenceSource,
    String occurredOn,
    List<String> linkedAssumptions,
    NarrativeCategory narrativeCategory,
    List<String> tags,
    Instant createdAt,
    Instant updatedAt
) {
    public Evidence {
        linkedAssumptions = linkedAssumptions == null ? null : List.copyOf(linkedAssumptions);
        tags = tags == null ? null : List.copyOf(tags);
    }
}
