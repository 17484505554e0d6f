package com.venturegate.boundary;

import java.util.Arrays;
import java.util.Optional;

/**
 * Column ↔ property mapping for user evidence rows. This table is the only place the
 * two naming conventions meet; nothing downstream reads raw columns.
 */
public enum EvidenceField implements RowField {
    ID("id", "id"),
    PROJECT_ID("project_id", "projectId"),
    TITLE("title", "title"),
    EVIDENCE_CATEGORY("evidence_category", "category"),
    SUMMARY("summary", "summary"),
    FULL_TEXT("full_text", "fullText"),
    CONTENT("content", "content"),
    STRENGTH("strength", "strength"),
    IS_CONTRADICTION("is_contradiction", "contradiction"),
    FIT_TYPE("fit_type", "fitType"),
    SOURCE_TYPE("source_type", "sourceType"),
    SOURCE_URL("source_url", "sourceUrl"),
    AUTHOR("author", "author"),
    EVIDENCE_SOURCE("evidence_source", "evidenceSource"),
    OCCURRED_ON("occurred_on", "occurredOn"),
    LINKED_ASSUMPTIONS("linked_assumptions", "linkedAssumptions"),
    NARRATIVE_CATEGORY("narrative_category", "narrativeCategory"),
    TAGS("tags", "tags"),
    CREATED_AT("created_at", "createdAt"),
    UPDATED_AT("updated_at", "updatedAt");

    private final String column;
    private final String property;

    EvidenceField(String column, String property) {
        this.column = column;
        this.property = property;
    }

    @Override
    public String column() {
        return column;
    }

    @Override
    public String property() {
        return property;
    }

    public static Optional<EvidenceField> fromColumn(String column) {
        return Arrays.stream(values()).filter(f -> f.column.equals(column)).findFirst();
    }

    public static Optional<EvidenceField> fromProperty(String property) {
        return Arrays.stream(values()).filter(f -> f.property.equals(property)).findFirst();
    }
}
