package com.venturegate.boundary;

/**
 * The two row shapes crossing the boundary, with the table name used in issue paths
 * and the schema version reported alongside logged issues.
 */
public enum EntityKind {
    EVIDENCE("evidence", "Evidence", "1.0"),
    VALIDATION_STATE("validation_states", "Validation state", "1.0");

    private final String table;
    private final String label;
    private final String schemaVersion;

    EntityKind(String table, String label, String schemaVersion) {
        this.table = table;
        this.label = label;
        this.schemaVersion = schemaVersion;
    }

    public String getTable() {
        return table;
    }

    public String getLabel() {
        return label;
    }

    public String getSchemaVersion() {
        return schemaVersion;
    }
}
