package org.carball.querylens.model.query;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Point-in-time statistics for one query fingerprint.
 */
@Value
@Builder(toBuilder = true)
public class QueryMetrics {
    String fingerprint;
    String sampleText;
    long executionCount;
    double totalDurationMs;
    double avgDurationMs;
    double minDurationMs;
    double maxDurationMs;
    long rowsExamined;
    long rowsReturned;
    int tableScanCount;
    int indexScanCount;
    boolean planApplied;
    Instant firstSeen;
    Instant lastSeen;

    /**
     * Fraction of examined rows that were returned per execution, in [0, 1].
     * Without plan information nothing is known about over-fetching and the ratio is 1.
     */
    public double getEfficiencyRatio() {
        if (rowsExamined <= 0) {
            return 1.0;
        }
        double returnedPerExecution = (double) rowsReturned / Math.max(executionCount, 1);
        return Math.max(0.0, Math.min(1.0, returnedPerExecution / rowsExamined));
    }

    /**
     * Overall score from 0 to 100: half duration penalty, half efficiency.
     */
    public double getPerformanceScore() {
        double durationScore = Math.max(0.0, 100.0 - (avgDurationMs / 100.0));
        double efficiencyScore = getEfficiencyRatio() * 100.0;
        return (durationScore + efficiencyScore) / 2.0;
    }
}
