package com.venturegate.boundary;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How the boundary reacts to a malformed row.
 * <ul>
 *   <li>{@link #OPEN}: drop the row, sample its issues into the log, keep the valid rows</li>
 *   <li>{@link #CLOSED}: abort the whole batch with {@link BoundaryValidationException}</li>
 * </ul>
 */
public enum ValidationMode {
    OPEN("open"),
    CLOSED("closed");

    private final String value;

    ValidationMode(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
