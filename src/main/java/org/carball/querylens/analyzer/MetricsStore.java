package org.carball.querylens.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.querylens.model.plan.ExecutionPlan;
import org.carball.querylens.model.query.QueryMetrics;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Running statistics per query fingerprint.
 * <p>
 * Each fingerprint has its own accumulator, so concurrent recorders only contend when they
 * report the same query shape. Readers always receive immutable {@link QueryMetrics}
 * snapshots. When more than {@code maxEntries} fingerprints are tracked, the one with the
 * oldest {@code lastSeen} is evicted and the eviction listener is notified.
 */
@Slf4j
public class MetricsStore {

    private final Map<String, MetricsAccumulator> metrics = new ConcurrentHashMap<>();
    private final Object evictionLock = new Object();
    private final int maxEntries;
    private final int sampleTextMaxLength;
    private volatile Consumer<String> evictionListener = fingerprint -> { };

    public MetricsStore(int maxEntries, int sampleTextMaxLength) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive: " + maxEntries);
        }
        this.maxEntries = maxEntries;
        this.sampleTextMaxLength = sampleTextMaxLength;
    }

    public void setEvictionListener(Consumer<String> evictionListener) {
        this.evictionListener = evictionListener != null ? evictionListener : fingerprint -> { };
    }

    /**
     * Records one execution and returns the updated snapshot. Duration and row count are
     * optional; an absent duration still counts as an execution.
     */
    public QueryMetrics record(String fingerprint, String sampleText, Double durationMs, Long rowsReturned, Instant at) {
        boolean[] created = new boolean[1];
        MetricsAccumulator accumulator = metrics.computeIfAbsent(fingerprint, fp -> {
            created[0] = true;
            return new MetricsAccumulator(fp, truncate(sampleText), at);
        });

        QueryMetrics snapshot = accumulator.observe(durationMs, rowsReturned, at);

        if (created[0]) {
            log.debug("Tracking new query fingerprint {}", fingerprint);
            evictIfNeeded(fingerprint);
        }
        return snapshot;
    }

    /**
     * Applies plan-derived statistics to a fingerprint. Returns false when the fingerprint is
     * not tracked or already has a plan.
     */
    public boolean applyPlan(String fingerprint, ExecutionPlan plan) {
        MetricsAccumulator accumulator = metrics.get(fingerprint);
        if (accumulator == null) {
            return false;
        }
        return accumulator.applyPlan(plan);
    }

    public Optional<QueryMetrics> get(String fingerprint) {
        MetricsAccumulator accumulator = metrics.get(fingerprint);
        return accumulator == null ? Optional.empty() : Optional.of(accumulator.snapshot());
    }

    public List<QueryMetrics> snapshot() {
        List<QueryMetrics> result = new ArrayList<>(metrics.size());
        for (MetricsAccumulator accumulator : metrics.values()) {
            result.add(accumulator.snapshot());
        }
        return result;
    }

    public List<QueryMetrics> topByAvgDuration(int limit) {
        return select(m -> true, Comparator.comparingDouble(QueryMetrics::getAvgDurationMs).reversed(), limit);
    }

    public List<QueryMetrics> topByLowEfficiency(int limit) {
        return select(m -> true, Comparator.comparingDouble(QueryMetrics::getEfficiencyRatio), limit);
    }

    public List<QueryMetrics> topByFrequency(int limit) {
        return select(m -> true, Comparator.comparingLong(QueryMetrics::getExecutionCount).reversed(), limit);
    }

    /**
     * Queries whose average duration is at or above the threshold, slowest first.
     */
    public List<QueryMetrics> slowQueries(double thresholdMs, int limit) {
        return select(m -> m.getAvgDurationMs() >= thresholdMs,
                Comparator.comparingDouble(QueryMetrics::getAvgDurationMs).reversed(), limit);
    }

    /**
     * Queries whose efficiency ratio is below the given ratio, least efficient first.
     */
    public List<QueryMetrics> inefficientQueries(double maxRatio, int limit) {
        return select(m -> m.getEfficiencyRatio() < maxRatio,
                Comparator.comparingDouble(QueryMetrics::getEfficiencyRatio), limit);
    }

    public int size() {
        return metrics.size();
    }

    public void clear() {
        metrics.clear();
    }

    private List<QueryMetrics> select(Predicate<QueryMetrics> filter, Comparator<QueryMetrics> order, int limit) {
        return snapshot().stream()
                .filter(filter)
                .sorted(order.thenComparing(QueryMetrics::getFingerprint))
                .limit(Math.max(0, limit))
                .collect(Collectors.toList());
    }

    private void evictIfNeeded(String justAdded) {
        List<String> evicted = new ArrayList<>();
        synchronized (evictionLock) {
            while (metrics.size() > maxEntries) {
                Optional<String> oldest = metrics.entrySet().stream()
                        .filter(entry -> !entry.getKey().equals(justAdded))
                        .min(Comparator.comparing(
                                (Map.Entry<String, MetricsAccumulator> entry) -> entry.getValue().lastSeen(),
                                Comparator.nullsFirst(Comparator.<Instant>naturalOrder())))
                        .map(Map.Entry::getKey);
                if (oldest.isEmpty()) {
                    break;
                }
                metrics.remove(oldest.get());
                evicted.add(oldest.get());
            }
        }

        for (String fingerprint : evicted) {
            log.debug("Evicted query fingerprint {} (limit {})", fingerprint, maxEntries);
            evictionListener.accept(fingerprint);
        }
    }

    private String truncate(String sampleText) {
        if (sampleText == null) {
            return "";
        }
        return sampleText.length() > sampleTextMaxLength ? sampleText.substring(0, sampleTextMaxLength) : sampleText;
    }
}
