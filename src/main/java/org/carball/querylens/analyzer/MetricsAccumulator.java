package org.carball.querylens.analyzer;

import org.carball.querylens.model.plan.ExecutionPlan;
import org.carball.querylens.model.query.QueryMetrics;

import java.time.Instant;

/**
 * Mutable statistics for one fingerprint. All access goes through the instance monitor.
 */
class MetricsAccumulator {

    private final String fingerprint;
    private final String sampleText;
    private final Instant firstSeen;

    private long executionCount;
    private double totalDurationMs;
    private double minDurationMs;
    private double maxDurationMs;
    private boolean durationSeen;
    private long rowsExamined;
    private long rowsReturned;
    private int tableScanCount;
    private int indexScanCount;
    private boolean planApplied;
    private Instant lastSeen;

    MetricsAccumulator(String fingerprint, String sampleText, Instant firstSeen) {
        this.fingerprint = fingerprint;
        this.sampleText = sampleText;
        this.firstSeen = firstSeen;
        this.lastSeen = firstSeen;
    }

    synchronized QueryMetrics observe(Double durationMs, Long rows, Instant at) {
        executionCount++;
        if (at != null && (lastSeen == null || at.isAfter(lastSeen))) {
            lastSeen = at;
        }

        if (durationMs != null) {
            double duration = Math.max(0.0, durationMs);
            totalDurationMs += duration;
            if (!durationSeen) {
                minDurationMs = duration;
                maxDurationMs = duration;
                durationSeen = true;
            } else {
                minDurationMs = Math.min(minDurationMs, duration);
                maxDurationMs = Math.max(maxDurationMs, duration);
            }
        }

        if (rows != null && rows > 0) {
            rowsReturned += rows;
        }
        return snapshot();
    }

    /**
     * Copies plan statistics once; later plans for the same fingerprint are ignored.
     */
    synchronized boolean applyPlan(ExecutionPlan plan) {
        if (planApplied) {
            return false;
        }
        rowsExamined = Math.max(0, plan.getRowsExamined());
        tableScanCount = plan.getTableScans().size();
        indexScanCount = plan.getIndexScans().size();
        planApplied = true;
        return true;
    }

    synchronized Instant lastSeen() {
        return lastSeen;
    }

    synchronized QueryMetrics snapshot() {
        return QueryMetrics.builder()
                .fingerprint(fingerprint)
                .sampleText(sampleText)
                .executionCount(executionCount)
                .totalDurationMs(totalDurationMs)
                .avgDurationMs(executionCount > 0 ? totalDurationMs / executionCount : 0.0)
                .minDurationMs(minDurationMs)
                .maxDurationMs(maxDurationMs)
                .rowsExamined(rowsExamined)
                .rowsReturned(rowsReturned)
                .tableScanCount(tableScanCount)
                .indexScanCount(indexScanCount)
                .planApplied(planApplied)
                .firstSeen(firstSeen)
                .lastSeen(lastSeen)
                .build();
    }
}
