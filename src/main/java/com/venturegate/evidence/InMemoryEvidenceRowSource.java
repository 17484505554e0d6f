package com.venturegate.evidence;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Append-only in-memory row source. Each read returns a fresh list, so a batch
 * identity never outlives the request that fetched it.
 */
@Component
public class InMemoryEvidenceRowSource implements EvidenceRowSource {

    private static final String PROJECT_COLUMN = "project_id";

    private final CopyOnWriteArrayList<Map<String, Object>> evidence = new CopyOnWriteArrayList<>();
    private final CopyOnWriteArrayList<Map<String, Object>> validationStates = new CopyOnWriteArrayList<>();

    public void appendEvidenceRow(Map<String, Object> row) {
        evidence.add(row);
    }

    public void appendValidationStateRow(Map<String, Object> row) {
        validationStates.add(row);
    }

    @Override
    public List<Map<String, Object>> evidenceRows(String projectId) {
        return rowsFor(evidence, projectId);
    }

    @Override
    public List<Map<String, Object>> validationStateRows(String projectId) {
        return rowsFor(validationStates, projectId);
    }

    private List<Map<String, Object>> rowsFor(List<Map<String, Object>> rows, String projectId) {
        return rows.stream()
            .filter(row -> Objects.equals(projectId, row.get(PROJECT_COLUMN)))
            .collect(Collectors.toCollection(ArrayList::new));
    }
}
