package com.venturegate.evidence;

/**
 * A categorical assessment produced by automated analysis for one dimension at one iteration.
 * <p>
 * Each implementation is a closed enum. Two tables hang off every constant and are
 * reproduced exactly from the product's domain rules:
 * <ul>
 *   <li>{@link #strength()} buckets the signal into weak/medium/strong for gate counting</li>
 *   <li>{@link #trendValue()} projects the signal onto an ordinal scale for trend charts,
 *       keeping distinctions the strength bucket collapses (zombie market vs. underwater)</li>
 * </ul>
 */
public interface Signal {

    /** Wire value, e.g. "strong_commitment". */
    String getValue();

    /** Human label, e.g. "Strong Commitment". */
    String getLabel();

    String getDescription();

    Dimension dimension();

    /** Whether this is the dimension's "not yet assessed" value. */
    boolean isNeutral();

    EvidenceStrength strength();

    double trendValue();
}
