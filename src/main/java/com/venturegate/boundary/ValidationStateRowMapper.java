package com.venturegate.boundary;

import com.venturegate.evidence.DesirabilitySignal;
import com.venturegate.evidence.FeasibilitySignal;
import com.venturegate.evidence.ValidationState;
import com.venturegate.evidence.ViabilitySignal;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Translates between raw validation state rows and {@link ValidationState}, in both
 * directions, using {@link ValidationStateField} as the only source of column names.
 */
public class ValidationStateRowMapper {

    private final Clock clock;

    public ValidationStateRowMapper(Clock clock) {
        this.clock = clock;
    }

    public Optional<ValidationState> read(Map<String, Object> row, int index, List<BoundaryIssue> issues) {
        RowReader reader = new RowReader(row, EntityKind.VALIDATION_STATE, index);

        String id = reader.requiredString(ValidationStateField.ID);
        String projectId = reader.optionalString(ValidationStateField.PROJECT_ID);
        Integer iteration = reader.optionalInteger(ValidationStateField.ITERATION, 1);
        DesirabilitySignal desirability =
            reader.optionalEnum(ValidationStateField.DESIRABILITY_SIGNAL, DesirabilitySignal::find);
        FeasibilitySignal feasibility =
            reader.optionalEnum(ValidationStateField.FEASIBILITY_SIGNAL, FeasibilitySignal::find);
        ViabilitySignal viability =
            reader.optionalEnum(ValidationStateField.VIABILITY_SIGNAL, ViabilitySignal::find);
        Object desirabilityEvidence = reader.raw(ValidationStateField.DESIRABILITY_EVIDENCE);
        Object feasibilityEvidence = reader.raw(ValidationStateField.FEASIBILITY_EVIDENCE);
        Object viabilityEvidence = reader.raw(ValidationStateField.VIABILITY_EVIDENCE);
        Instant updatedAt = reader.timestamp(ValidationStateField.UPDATED_AT, clock);

        if (!reader.valid()) {
            issues.addAll(reader.issues());
            return Optional.empty();
        }

        return Optional.of(new ValidationState(
            id,
            projectId != null ? projectId : "",
            iteration != null ? iteration : 1,
            desirability != null ? desirability : DesirabilitySignal.NO_SIGNAL,
            feasibility != null ? feasibility : FeasibilitySignal.UNKNOWN,
            viability != null ? viability : ViabilitySignal.UNKNOWN,
            desirabilityEvidence,
            feasibilityEvidence,
            viabilityEvidence,
            updatedAt
        ));
    }

    public static Map<String, Object> toRow(ValidationState state) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put(ValidationStateField.ID.column(), state.id());
        row.put(ValidationStateField.PROJECT_ID.column(), state.projectId());
        row.put(ValidationStateField.ITERATION.column(), state.iteration());
        row.put(ValidationStateField.DESIRABILITY_SIGNAL.column(),
            state.desirabilitySignal() != null ? state.desirabilitySignal().getValue() : null);
        row.put(ValidationStateField.FEASIBILITY_SIGNAL.column(),
            state.feasibilitySignal() != null ? state.feasibilitySignal().getValue() : null);
        row.put(ValidationStateField.VIABILITY_SIGNAL.column(),
            state.viabilitySignal() != null ? state.viabilitySignal().getValue() : null);
        row.put(ValidationStateField.DESIRABILITY_EVIDENCE.column(), state.desirabilityEvidence());
        row.put(ValidationStateField.FEASIBILITY_EVIDENCE.column(), state.feasibilityEvidence());
        row.put(ValidationStateField.VIABILITY_EVIDENCE.column(), state.viabilityEvidence());
        row.put(ValidationStateField.UPDATED_AT.column(),
            state.updatedAt() != null ? state.updatedAt().toString() : null);
        return row;
    }
}
