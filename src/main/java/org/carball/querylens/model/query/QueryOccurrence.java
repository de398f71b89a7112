package org.carball.querylens.model.query;

import java.time.Instant;

/**
 * One entry of the occurrence log used for N+1 detection.
 */
public record QueryOccurrence(String fingerprint, Instant timestamp) {}
