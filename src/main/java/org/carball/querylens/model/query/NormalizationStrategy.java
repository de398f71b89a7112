package org.carball.querylens.model.query;

/**
 * Which normalization path produced a {@link NormalizedQuery}.
 */
public enum NormalizationStrategy {
    /** Statement was parsed and re-emitted with literals replaced. */
    PARSED,
    /** Parsing failed; literals were replaced with regular expressions. */
    FALLBACK
}
