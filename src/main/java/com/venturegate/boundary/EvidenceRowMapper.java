package com.venturegate.boundary;

import com.venturegate.evidence.Evidence;
import com.venturegate.evidence.EvidenceCategory;
import com.venturegate.evidence.EvidenceStrength;
import com.venturegate.evidence.FitType;
import com.venturegate.evidence.NarrativeCategory;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Translates between raw evidence rows and {@link Evidence}, in both directions,
 * using {@link EvidenceField} as the only source of column names.
 */
public class EvidenceRowMapper {

    private final Clock clock;

    public EvidenceRowMapper(Clock clock) {
        this.clock = clock;
    }

    /**
     * @param issues receives every issue found in the row
     * @return the normalized evidence, or empty when the row has at least one issue
     */
    public Optional<Evidence> read(Map<String, Object> row, int index, List<BoundaryIssue> issues) {
        RowReader reader = new RowReader(row, EntityKind.EVIDENCE, index);

        String id = reader.requiredString(EvidenceField.ID);
        String projectId = reader.optionalString(EvidenceField.PROJECT_ID);
        String title = reader.optionalString(EvidenceField.TITLE);
        EvidenceCategory category = reader.optionalEnum(EvidenceField.EVIDENCE_CATEGORY, EvidenceCategory::find);
        String summary = reader.optionalString(EvidenceField.SUMMARY);
        String fullText = reader.optionalString(EvidenceField.FULL_TEXT);
        String content = reader.optionalString(EvidenceField.CONTENT);
        EvidenceStrength strength = reader.optionalEnum(EvidenceField.STRENGTH, EvidenceStrength::find);
        Boolean contradiction = reader.optionalBoolean(EvidenceField.IS_CONTRADICTION);
        FitType fitType = reader.optionalEnum(EvidenceField.FIT_TYPE, FitType::find);
        String sourceType = reader.optionalString(EvidenceField.SOURCE_TYPE);
        String sourceUrl = reader.optionalString(EvidenceField.SOURCE_URL);
        String author = reader.optionalString(EvidenceField.AUTHOR);
        String evidenceSource = reader.optionalString(EvidenceField.EVIDENCE_SOURCE);
        String occurredOn = reader.optionalDate(EvidenceField.OCCURRED_ON);
        List<String> linkedAssumptions = reader.optionalStringList(EvidenceField.LINKED_ASSUMPTIONS);
        NarrativeCategory narrativeCategory = reader.optionalEnum(EvidenceField.NARRATIVE_CATEGORY, NarrativeCategory::find);
        List<String> tags = reader.optionalStringList(EvidenceField.TAGS);
        Instant createdAt = reader.timestamp(EvidenceField.CREATED_AT, clock);
        Instant updatedAt = reader.timestamp(EvidenceField.UPDATED_AT, clock);

        if (!reader.valid()) {
            issues.addAll(reader.issues());
            return Optional.empty();
        }

        return Optional.of(new Evidence(
            id,
            projectId != null && !projectId.isEmpty() ? projectId : "",
            title,
            category,
            summary,
            fullText,
            content != null ? content : "",
            strength,
            Boolean.TRUE.equals(contradiction),
            fitType,
            sourceType,
            sourceUrl,
            author,
            evidenceSource,
            occurredOn,
            linkedAssumptions,
            narrativeCategory,
            tags,
            createdAt,
            updatedAt
        ));
    }

    public static Map<String, Object> toRow(Evidence evidence) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put(EvidenceField.ID.column(), evidence.id());
        row.put(EvidenceField.PROJECT_ID.column(), evidence.projectId());
        row.put(EvidenceField.TITLE.column(), evidence.title());
        row.put(EvidenceField.EVIDENCE_CATEGORY.column(),
            evidence.category() != null ? evidence.category().getValue() : null);
        row.put(EvidenceField.SUMMARY.column(), evidence.summary());
        row.put(EvidenceField.FULL_TEXT.column(), evidence.fullText());
        row.put(EvidenceField.CONTENT.column(), evidence.content());
        row.put(EvidenceField.STRENGTH.column(),
            evidence.strength() != null ? evidence.strength().getValue() : null);
        row.put(EvidenceField.IS_CONTRADICTION.column(), evidence.contradiction());
        row.put(EvidenceField.FIT_TYPE.column(),
            evidence.fitType() != null ? evidence.fitType().getValue() : null);
        row.put(EvidenceField.SOURCE_TYPE.column(), evidence.sourceType());
        row.put(EvidenceField.SOURCE_URL.column(), evidence.sourceUrl());
        row.put(EvidenceField.AUTHOR.column(), evidence.author());
        row.put(EvidenceField.EVIDENCE_SOURCE.column(), evidence.evidenceSource());
        row.put(EvidenceField.OCCURRED_ON.column(), evidence.occurredOn());
        row.put(EvidenceField.LINKED_ASSUMPTIONS.column(), evidence.linkedAssumptions());
        row.put(EvidenceField.NARRATIVE_CATEGORY.column(),
            evidence.narrativeCategory() != null ? evidence.narrativeCategory().getValue() : null);
        row.put(EvidenceField.TAGS.column(), evidence.tags());
        row.put(EvidenceField.CREATED_AT.column(), evidence.createdAt().toString());
        row.put(EvidenceField.UPDATED_AT.column(), evidence.updatedAt().toString());
        return row;
    }
}
