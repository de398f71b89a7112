package org.carball.querylens.model.query;

import java.time.Instant;

/**
 * A statement read from a query log export, replayed into the engine.
 * Duration, row count and timestamp are optional.
 */
public record LoggedQuery(
        String sqlText,
        Double durationMs,
        Long rowsReturned,
        Instant timestamp
) {}
