package com.venturegate.boundary;

import com.venturegate.evidence.Dimension;

import java.util.Arrays;
import java.util.Optional;

/**
 * Column ↔ property mapping for automated validation state rows.
 */
public enum ValidationStateField implements RowField {
    ID("id", "id"),
    PROJECT_ID("project_id", "projectId"),
    ITERATION("iteration", "iteration"),
    DESIRABILITY_SIGNAL("desirability_signal", "desirabilitySignal"),
    FEASIBILITY_SIGNAL("feasibility_signal", "feasibilitySignal"),
    VIABILITY_SIGNAL("viability_signal", "viabilitySignal"),
    DESIRABILITY_EVIDENCE("desirability_evidence", "desirabilityEvidence"),
    FEASIBILITY_EVIDENCE("feasibility_evidence", "feasibilityEvidence"),
    VIABILITY_EVIDENCE("viability_evidence", "viabilityEvidence"),
    UPDATED_AT("updated_at", "updatedAt");

    private final String column;
    private final String property;

    ValidationStateField(String column, String property) {
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

    public static ValidationStateField signalOf(Dimension dimension) {
        return switch (dimension) {
            case DESIRABILITY -> DESIRABILITY_SIGNAL;
            case FEASIBILITY -> FEASIBILITY_SIGNAL;
            case VIABILITY -> VIABILITY_SIGNAL;
        };
    }

    public static ValidationStateField evidenceOf(Dimension dimension) {
        return switch (dimension) {
            case DESIRABILITY -> DESIRABILITY_EVIDENCE;
            case FEASIBILITY -> FEASIBILITY_EVIDENCE;
            case VIABILITY -> VIABILITY_EVIDENCE;
        };
    }

    public static Optional<ValidationStateField> fromColumn(String column) {
        return Arrays.stream(values()).filter(f -> f.column.equals(column)).findFirst();
    }

    public static Optional<ValidationStateField> fromProperty(String property) {
        return Arrays.stream(values()).filter(f -> f.property.equals(property)).findFirst();
    }
}
