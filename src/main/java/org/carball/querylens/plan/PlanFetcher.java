package org.carball.querylens.plan;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;

/**
 * Obtains a structured execution plan for a statement from the database. Implemented once
 * per host driver; the analysis engine only depends on this interface.
 */
@FunctionalInterface
public interface PlanFetcher {

    /**
     * Returns the plan document in PostgreSQL's {@code EXPLAIN (FORMAT JSON)} shape.
     *
     * @param sql statement to explain
     * @param analyze also execute the statement and collect actual run statistics
     * @param timeout upper bound for the whole request
     */
    JsonNode explain(String sql, boolean analyze, Duration timeout) throws PlanFetchException;
}
