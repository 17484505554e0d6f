package com.venturegate.boundary;

/**
 * A single validation problem found in a raw row.
 *
 * @param path    table, row index and column, e.g. {@code evidence.3.strength}
 * @param code    machine-readable issue code ({@code required}, {@code invalid_type}, {@code invalid_enum_value}, ...)
 * @param message human-readable detail; never contains the offending value
 */
public record BoundaryIssue(String path, String code, String message) {

    public static final String REQUIRED = "required";
    public static final String INVALID_TYPE = "invalid_type";
    public static final String INVALID_ENUM_VALUE = "invalid_enum_value";
    public static final String TOO_SMALL = "too_small";
}
