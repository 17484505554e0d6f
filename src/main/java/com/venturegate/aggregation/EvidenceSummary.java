package com.venturegate.aggregation;

import com.venturegate.evidence.Dimension;
import com.venturegate.evidence.EvidenceStrength;

/**
 * Counts over a list of evidence items. Contradictions count user evidence only.
 */
public record EvidenceSummary(
    int total,
    DimensionCounts byDimension,
    StrengthCounts byStrength,
    SourceCounts bySource,
    int contradictions
) {

    public record DimensionCounts(int desirability, int feasibility, int viability) {
        public int count(Dimension dimension) {
            return switch (dimension) {
                case DESIRABILITY -> desirability;
                case FEASIBILITY -> feasibility;
                case VIABILITY -> viability;
            };
        }
    }

    public record StrengthCounts(int weak, int medium, int strong) {
        public int count(EvidenceStrength strength) {
            return switch (strength) {
                case WEAK -> weak;
                case MEDIUM -> medium;
                case STRONG -> strong;
            };
        }
    }

    public record SourceCounts(int user, int ai) {
        public int count(EvidenceOrigin origin) {
            return switch (origin) {
                case USER -> user;
                case AUTOMATED -> ai;
            };
        }
    }
}
