package org.carball.querylens.model.query;

/**
 * Literal-free form of a SQL statement together with its fingerprint.
 *
 * @param explainable whether the statement is a query or DML that EXPLAIN accepts
 */
public record NormalizedQuery(
        String normalizedText,
        String fingerprint,
        NormalizationStrategy strategy,
        boolean explainable
) {

    public boolean isParsed() {
        return strategy == NormalizationStrategy.PARSED;
    }
}
