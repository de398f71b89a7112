package org.carball.querylens.analyzer;

import org.carball.querylens.model.plan.ExecutionPlan;
import org.carball.querylens.model.query.QueryMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

public class MetricsStoreTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private MetricsStore store;

    @BeforeEach
    void setUp() {
        store = new MetricsStore(100, 500);
    }

    @Test
    void shouldCreateMetricsFromFirstObservation() {
        // When
        QueryMetrics metrics = store.record("fp1", "SELECT 1", 25.0, 3L, T0);

        // Then
        assertThat(metrics.getExecutionCount()).isEqualTo(1);
        assertThat(metrics.getTotalDurationMs()).isEqualTo(25.0);
        assertThat(metrics.getAvgDurationMs()).isEqualTo(25.0);
        assertThat(metrics.getMinDurationMs()).isEqualTo(25.0);
        assertThat(metrics.getMaxDurationMs()).isEqualTo(25.0);
        assertThat(metrics.getRowsReturned()).isEqualTo(3);
        assertThat(metrics.getFirstSeen()).isEqualTo(T0);
        assertThat(metrics.getLastSeen()).isEqualTo(T0);
        assertThat(metrics.isPlanApplied()).isFalse();
    }

    @Test
    void shouldAggregateDurationsAndRows() {
        // When
        store.record("fp1", "SELECT 1", 10.0, 1L, T0);
        store.record("fp1", "SELECT 1", 30.0, 2L, T0.plusSeconds(1));
        QueryMetrics metrics = store.record("fp1", "SELECT 1", 20.0, 3L, T0.plusSeconds(2));

        // Then
        assertThat(metrics.getExecutionCount()).isEqualTo(3);
        assertThat(metrics.getTotalDurationMs()).isEqualTo(60.0);
        assertThat(metrics.getAvgDurationMs()).isEqualTo(20.0);
        assertThat(metrics.getMinDurationMs()).isEqualTo(10.0);
        assertThat(metrics.getMaxDurationMs()).isEqualTo(30.0);
        assertThat(metrics.getMinDurationMs()).isLessThanOrEqualTo(metrics.getAvgDurationMs());
        assertThat(metrics.getAvgDurationMs()).isLessThanOrEqualTo(metrics.getMaxDurationMs());
        assertThat(metrics.getRowsReturned()).isEqualTo(6);
        assertThat(metrics.getLastSeen()).isEqualTo(T0.plusSeconds(2));
    }

    @Test
    void shouldCountExecutionsWithoutDuration() {
        // When
        store.record("fp1", "SELECT 1", 40.0, null, T0);
        QueryMetrics metrics = store.record("fp1", "SELECT 1", null, null, T0);

        // Then
        assertThat(metrics.getExecutionCount()).isEqualTo(2);
        assertThat(metrics.getTotalDurationMs()).isEqualTo(40.0);
        assertThat(metrics.getAvgDurationMs()).isEqualTo(20.0);
        assertThat(metrics.getAvgDurationMs())
                .isEqualTo(metrics.getTotalDurationMs() / metrics.getExecutionCount());
    }

    @Test
    void shouldTruncateSampleText() {
        // Given
        MetricsStore smallSamples = new MetricsStore(10, 20);

        // When
        QueryMetrics metrics = smallSamples.record("fp1", "SELECT * FROM a_really_long_table_name", 1.0, 1L, T0);

        // Then
        assertThat(metrics.getSampleText()).hasSize(20);
    }

    @Test
    void shouldReportFullEfficiencyWithoutPlan() {
        // When
        QueryMetrics metrics = store.record("fp1", "SELECT 1", 1.0, 0L, T0);

        // Then
        assertThat(metrics.getRowsExamined()).isZero();
        assertThat(metrics.getEfficiencyRatio()).isEqualTo(1.0);
    }

    @Test
    void shouldApplyPlanOnceAndDeriveEfficiency() {
        // Given
        store.record("fp1", "SELECT * FROM properties", 100.0, 10L, T0);
        store.record("fp1", "SELECT * FROM properties", 100.0, 10L, T0);
        ExecutionPlan plan = ExecutionPlan.builder()
                .fingerprint("fp1")
                .rowsEstimated(1000)
                .tableScan("properties")
                .build();
        ExecutionPlan laterPlan = ExecutionPlan.builder().fingerprint("fp1").rowsEstimated(5).build();

        // When
        boolean applied = store.applyPlan("fp1", plan);
        boolean appliedAgain = store.applyPlan("fp1", laterPlan);
        QueryMetrics metrics = store.get("fp1").orElseThrow();

        // Then
        assertThat(applied).isTrue();
        assertThat(appliedAgain).isFalse();
        assertThat(metrics.getRowsExamined()).isEqualTo(1000);
        assertThat(metrics.getTableScanCount()).isEqualTo(1);
        assertThat(metrics.isPlanApplied()).isTrue();
        // 20 rows over 2 runs = 10 per run, out of 1000 examined
        assertThat(metrics.getEfficiencyRatio()).isCloseTo(0.01, within(1e-9));
        assertThat(metrics.getPerformanceScore()).isCloseTo((99.0 + 1.0) / 2, within(1e-9));
    }

    @Test
    void shouldClampEfficiencyToOne() {
        // Given
        store.record("fp1", "SELECT 1", 1.0, 500L, T0);
        store.applyPlan("fp1", ExecutionPlan.builder().fingerprint("fp1").rowsEstimated(10).build());

        // When
        QueryMetrics metrics = store.get("fp1").orElseThrow();

        // Then
        assertThat(metrics.getEfficiencyRatio()).isEqualTo(1.0);
        assertThat(metrics.getPerformanceScore()).isBetween(0.0, 100.0);
    }

    @Test
    void shouldIgnorePlanForUnknownFingerprint() {
        assertThat(store.applyPlan("missing", ExecutionPlan.builder().fingerprint("missing").build())).isFalse();
    }

    @Test
    void shouldEvictOldestLastSeenBeyondCapacity() {
        // Given
        MetricsStore bounded = new MetricsStore(2, 500);
        List<String> evicted = new ArrayList<>();
        bounded.setEvictionListener(evicted::add);

        // When
        bounded.record("old", "SELECT 1", 1.0, 1L, T0);
        bounded.record("middle", "SELECT 2", 1.0, 1L, T0.plusSeconds(10));
        bounded.record("old", "SELECT 1", 1.0, 1L, T0.plusSeconds(20));
        bounded.record("new", "SELECT 3", 1.0, 1L, T0.plusSeconds(30));

        // Then
        assertThat(bounded.size()).isEqualTo(2);
        assertThat(evicted).containsExactly("middle");
        assertThat(bounded.get("old")).isPresent();
        assertThat(bounded.get("new")).isPresent();
    }

    @Test
    void shouldRankViews() {
        // Given
        store.record("fast", "SELECT 1", 5.0, 1L, T0);
        store.record("slow", "SELECT 2", 2500.0, 1L, T0);
        store.record("busy", "SELECT 3", 50.0, 1L, T0);
        store.record("busy", "SELECT 3", 50.0, 1L, T0);
        store.record("busy", "SELECT 3", 50.0, 1L, T0);
        store.record("wasteful", "SELECT 4", 20.0, 1L, T0);
        store.applyPlan("wasteful", ExecutionPlan.builder().fingerprint("wasteful").rowsEstimated(10_000).build());

        // Then
        assertThat(store.topByAvgDuration(2)).extracting(QueryMetrics::getFingerprint).containsExactly("slow", "busy");
        assertThat(store.topByFrequency(1)).extracting(QueryMetrics::getFingerprint).containsExactly("busy");
        assertThat(store.slowQueries(1000, 10)).extracting(QueryMetrics::getFingerprint).containsExactly("slow");
        assertThat(store.inefficientQueries(0.1, 10)).extracting(QueryMetrics::getFingerprint).containsExactly("wasteful");
        assertThat(store.topByLowEfficiency(1)).extracting(QueryMetrics::getFingerprint).containsExactly("wasteful");
    }

    @Test
    void shouldNotLoseConcurrentUpdates() throws Exception {
        // Given
        int threads = 8;
        int perThread = 500;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);

        // When
        for (int t = 0; t < threads; t++) {
            pool.submit(() -> {
                start.await();
                for (int i = 0; i < perThread; i++) {
                    store.record("shared", "SELECT 1", 2.0, 1L, T0);
                }
                return null;
            });
        }
        start.countDown();
        pool.shutdown();
        assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        // Then
        QueryMetrics metrics = store.get("shared").orElseThrow();
        assertThat(metrics.getExecutionCount()).isEqualTo(threads * perThread);
        assertThat(metrics.getTotalDurationMs()).isEqualTo(2.0 * threads * perThread);
        assertThat(metrics.getRowsReturned()).isEqualTo(threads * perThread);
    }

    @Test
    void shouldClearAllMetrics() {
        // Given
        store.record("fp1", "SELECT 1", 1.0, 1L, T0);

        // When
        store.clear();

        // Then
        assertThat(store.size()).isZero();
        assertThat(store.snapshot()).isEmpty();
    }
}
