package org.carball.querylens.analyzer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.carball.querylens.model.plan.ExecutionPlan;
import org.carball.querylens.plan.PlanFetchException;
import org.carball.querylens.plan.PlanFetcher;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;

public class ExecutionPlanAnalyzerTest {

    private static final String SQL = "SELECT * FROM properties WHERE id = 1";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private ExecutionPlanAnalyzer analyzer;

    @AfterEach
    void tearDown() {
        if (analyzer != null) {
            analyzer.close();
        }
    }

    private JsonNode seqScanPlan() {
        try {
            return objectMapper.readTree("""
                    [{"Plan": {"Node Type": "Seq Scan", "Relation Name": "properties",
                               "Total Cost": 35.5, "Plan Rows": 2550}}]
                    """);
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }

    private ExecutionPlanAnalyzer newAnalyzer(PlanFetcher fetcher, int workers, int queue, Duration timeout) {
        analyzer = new ExecutionPlanAnalyzer(fetcher, false, timeout, workers, queue);
        return analyzer;
    }

    @Test
    void shouldFetchEachFingerprintOnlyOnce() {
        // Given
        AtomicInteger calls = new AtomicInteger();
        newAnalyzer((sql, analyze, timeout) -> {
            calls.incrementAndGet();
            return seqScanPlan();
        }, 2, 10, Duration.ofSeconds(5));

        // When
        Optional<ExecutionPlan> first = analyzer.analyze("fp1", SQL);
        Optional<ExecutionPlan> second = analyzer.analyze("fp1", SQL);

        // Then
        assertThat(calls.get()).isEqualTo(1);
        assertThat(first).isPresent();
        assertThat(second).containsSame(first.get());
        assertThat(analyzer.getCachedPlan("fp1")).isPresent();
        assertThat(analyzer.cachedPlanCount()).isEqualTo(1);
        assertThat(first.get().getTableScans()).containsExactly("properties");
    }

    @Test
    void shouldRetryFailedFetchOnlyAfterBackoff() {
        // Given
        AtomicInteger calls = new AtomicInteger();
        AtomicLong nanos = new AtomicLong();
        analyzer = new ExecutionPlanAnalyzer((sql, analyze, timeout) -> {
            if (calls.incrementAndGet() == 1) {
                throw new PlanFetchException("connection refused");
            }
            return seqScanPlan();
        }, false, Duration.ofSeconds(5), 1, 10, 3, Duration.ofMinutes(1), nanos::get);

        // When
        Optional<ExecutionPlan> failed = analyzer.analyze("fp1", SQL);

        // Then
        assertThat(failed).isEmpty();
        assertThat(analyzer.getCachedPlan("fp1")).isEmpty();
        assertThat(analyzer.isInFlight("fp1")).isFalse();
        assertThat(analyzer.failedAttempts("fp1")).isEqualTo(1);

        // When
        Optional<ExecutionPlan> tooSoon = analyzer.analyze("fp1", SQL);

        // Then
        assertThat(tooSoon).isEmpty();
        assertThat(calls.get()).isEqualTo(1);

        // When
        nanos.addAndGet(Duration.ofMinutes(1).toNanos());
        Optional<ExecutionPlan> retried = analyzer.analyze("fp1", SQL);

        // Then
        assertThat(retried).isPresent();
        assertThat(calls.get()).isEqualTo(2);
        assertThat(analyzer.failedAttempts("fp1")).isZero();
    }

    @Test
    void shouldDoubleBackoffAfterEachFailure() {
        // Given
        AtomicInteger calls = new AtomicInteger();
        AtomicLong nanos = new AtomicLong();
        analyzer = new ExecutionPlanAnalyzer((sql, analyze, timeout) -> {
            calls.incrementAndGet();
            throw new PlanFetchException("relation does not exist");
        }, false, Duration.ofSeconds(5), 1, 10, 5, Duration.ofSeconds(10), nanos::get);
        analyzer.analyze("fp1", SQL);

        // When: the first retry is due after 10s, the second only after a further 20s
        nanos.addAndGet(Duration.ofSeconds(10).toNanos());
        analyzer.analyze("fp1", SQL);
        nanos.addAndGet(Duration.ofSeconds(10).toNanos());
        analyzer.analyze("fp1", SQL);

        // Then
        assertThat(calls.get()).isEqualTo(2);

        // When
        nanos.addAndGet(Duration.ofSeconds(10).toNanos());
        analyzer.analyze("fp1", SQL);

        // Then
        assertThat(calls.get()).isEqualTo(3);
        assertThat(analyzer.failedAttempts("fp1")).isEqualTo(3);
    }

    @Test
    void shouldStopFetchingAfterMaxAttempts() {
        // Given
        AtomicInteger calls = new AtomicInteger();
        analyzer = new ExecutionPlanAnalyzer((sql, analyze, timeout) -> {
            calls.incrementAndGet();
            throw new PlanFetchException("syntax error at or near \"$1\"");
        }, false, Duration.ofSeconds(5), 1, 10, 3, Duration.ZERO);

        // When
        for (int i = 0; i < 200; i++) {
            analyzer.analyze("fp1", SQL);
        }

        // Then
        assertThat(calls.get()).isEqualTo(3);
        assertThat(analyzer.failedAttempts("fp1")).isEqualTo(3);
        assertThat(analyzer.isInFlight("fp1")).isFalse();
    }

    @Test
    void shouldForgetFailuresOnEvict() {
        // Given
        AtomicInteger calls = new AtomicInteger();
        analyzer = new ExecutionPlanAnalyzer((sql, analyze, timeout) -> {
            calls.incrementAndGet();
            throw new PlanFetchException("connection refused");
        }, false, Duration.ofSeconds(5), 1, 10, 1, Duration.ofHours(1));
        analyzer.analyze("fp1", SQL);
        analyzer.analyze("fp1", SQL);
        assertThat(calls.get()).isEqualTo(1);

        // When
        analyzer.evict("fp1");
        analyzer.analyze("fp1", SQL);

        // Then
        assertThat(calls.get()).isEqualTo(2);
    }

    @Test
    void shouldNotCacheMalformedPlan() throws Exception {
        // Given
        JsonNode malformed = objectMapper.readTree("{\"Plan\": {\"Total Cost\": 1.0}}");
        newAnalyzer((sql, analyze, timeout) -> malformed, 1, 10, Duration.ofSeconds(5));

        // When
        Optional<ExecutionPlan> result = analyzer.analyze("fp1", SQL);

        // Then
        assertThat(result).isEmpty();
        assertThat(analyzer.cachedPlanCount()).isZero();
    }

    @Test
    void shouldShareInFlightFetch() throws Exception {
        // Given
        AtomicInteger calls = new AtomicInteger();
        CountDownLatch release = new CountDownLatch(1);
        newAnalyzer((sql, analyze, timeout) -> {
            calls.incrementAndGet();
            await(release);
            return seqScanPlan();
        }, 2, 10, Duration.ofSeconds(5));

        // When
        List<CompletableFuture<Optional<ExecutionPlan>>> futures = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            futures.add(analyzer.analyzeAsync("fp1", SQL));
        }
        assertThat(analyzer.isInFlight("fp1")).isTrue();
        release.countDown();

        // Then
        for (CompletableFuture<Optional<ExecutionPlan>> future : futures) {
            assertThat(future.get(5, TimeUnit.SECONDS)).isPresent();
        }
        assertThat(calls.get()).isEqualTo(1);
        assertThat(analyzer.isInFlight("fp1")).isFalse();
    }

    @Test
    void shouldTreatFullQueueAsFailure() throws Exception {
        // Given
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        newAnalyzer((sql, analyze, timeout) -> {
            started.countDown();
            await(release);
            return seqScanPlan();
        }, 1, 1, Duration.ofSeconds(5));

        // When
        CompletableFuture<Optional<ExecutionPlan>> running = analyzer.analyzeAsync("fp1", SQL);
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        CompletableFuture<Optional<ExecutionPlan>> queued = analyzer.analyzeAsync("fp2", SQL);
        CompletableFuture<Optional<ExecutionPlan>> rejected = analyzer.analyzeAsync("fp3", SQL);

        // Then
        assertThat(rejected).isCompletedWithValue(Optional.empty());
        assertThat(analyzer.isInFlight("fp3")).isFalse();

        release.countDown();
        assertThat(running.get(5, TimeUnit.SECONDS)).isPresent();
        assertThat(queued.get(5, TimeUnit.SECONDS)).isPresent();
    }

    @Test
    void shouldGiveUpWaitingAfterTimeout() {
        // Given
        CountDownLatch release = new CountDownLatch(1);
        newAnalyzer((sql, analyze, timeout) -> {
            await(release);
            return seqScanPlan();
        }, 1, 10, Duration.ofMillis(200));

        // When
        Optional<ExecutionPlan> result = analyzer.analyze("fp1", SQL);

        // Then
        assertThat(result).isEmpty();
        release.countDown();
        assertThat(analyzer.awaitPending(Duration.ofSeconds(5))).isTrue();
        assertThat(analyzer.getCachedPlan("fp1")).isPresent();
    }

    @Test
    void shouldNotifyListenerWhenPlanIsCached() {
        // Given
        List<String> notified = new ArrayList<>();
        newAnalyzer((sql, analyze, timeout) -> seqScanPlan(), 1, 10, Duration.ofSeconds(5));
        analyzer.setPlanListener((fingerprint, plan) -> notified.add(fingerprint));

        // When
        analyzer.analyze("fp1", SQL);

        // Then
        assertThat(notified).containsExactly("fp1");
    }

    @Test
    void shouldPassAnalyzeModeToFetcher() {
        // Given
        List<Boolean> modes = new ArrayList<>();
        analyzer = new ExecutionPlanAnalyzer((sql, analyze, timeout) -> {
            modes.add(analyze);
            return seqScanPlan();
        }, true, Duration.ofSeconds(5), 1, 10);

        // When
        analyzer.analyze("fp1", SQL);

        // Then
        assertThat(modes).containsExactly(true);
    }

    @Test
    void shouldEvictAndClearCachedPlans() {
        // Given
        newAnalyzer((sql, analyze, timeout) -> seqScanPlan(), 1, 10, Duration.ofSeconds(5));
        analyzer.analyze("fp1", SQL);
        analyzer.analyze("fp2", SQL);

        // When
        analyzer.evict("fp1");

        // Then
        assertThat(analyzer.getCachedPlans()).containsOnlyKeys("fp2");

        // When
        analyzer.clear();

        // Then
        assertThat(analyzer.cachedPlanCount()).isZero();
    }

    @Test
    void shouldCompletePendingFuturesOnClose() throws Exception {
        // Given
        CountDownLatch release = new CountDownLatch(1);
        newAnalyzer((sql, analyze, timeout) -> {
            await(release);
            return seqScanPlan();
        }, 1, 10, Duration.ofMillis(500));
        analyzer.analyzeAsync("fp1", SQL);
        CompletableFuture<Optional<ExecutionPlan>> queued = analyzer.analyzeAsync("fp2", SQL);

        // When
        analyzer.close();
        release.countDown();

        // Then
        assertThat(queued.get(5, TimeUnit.SECONDS)).isEmpty();
    }

    private static void await(CountDownLatch latch) throws PlanFetchException {
        try {
            if (!latch.await(10, TimeUnit.SECONDS)) {
                throw new PlanFetchException("test latch never released");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PlanFetchException("interrupted", e);
        }
    }
}
