package org.carball.querylens.model.query;

/**
 * A statement whose JDBC {@code ?} markers were renumbered as {@code $1, $2, ...}.
 */
public record ParameterizedStatement(String text, int parameterCount) {

    public boolean hasParameters() {
        return parameterCount > 0;
    }
}
