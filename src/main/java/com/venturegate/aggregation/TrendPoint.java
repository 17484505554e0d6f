package com.venturegate.aggregation;

import java.time.Instant;

/**
 * One automated iteration projected onto the trend scale.
 * Desirability and feasibility range 0..3; viability 0..3 with zombie market at 1.5.
 *
 * @param date          short chart label, {@code MMM dd} in UTC
 * @param evidenceCount number of dimensions with a non-null evidence payload
 */
public record TrendPoint(
    String date,
    Instant timestamp,
    double desirability,
    double feasibility,
    double viability,
    int evidenceCount,
    int iteration
) {}
