package org.carball.querylens.analyzer;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.benmanes.caffeine.cache.AsyncCache;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;
import org.carball.querylens.model.plan.ExecutionPlan;
import org.carball.querylens.parser.ExecutionPlanParser;
import org.carball.querylens.plan.PlanFetchException;
import org.carball.querylens.plan.PlanFetcher;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiConsumer;
import java.util.stream.Collectors;

/**
 * Fetches, parses and caches one execution plan per fingerprint.
 * <p>
 * Plans live in a Caffeine {@link AsyncCache}: while a fetch is running, further requests
 * for the same fingerprint share its future, and a fetch that yields no plan leaves no
 * entry behind. Fetches run on a small bounded pool so recording never waits on the
 * database.
 * <p>
 * Failed fetches are remembered per fingerprint. The first retry is allowed after the
 * retry backoff, each further failure doubles the wait, and after the maximum number of
 * attempts the fingerprint is not fetched again until it is evicted or the cache cleared.
 * A full work queue is not counted as a failed attempt.
 */
@Slf4j
public class ExecutionPlanAnalyzer implements AutoCloseable {

    static final int DEFAULT_MAX_ATTEMPTS = 3;
    static final Duration DEFAULT_RETRY_BACKOFF = Duration.ofMinutes(1);

    private static final long MAX_FAILURE_RECORDS = 10_000;
    private static final int MAX_BACKOFF_DOUBLINGS = 16;

    private final PlanFetcher fetcher;
    private final ExecutionPlanParser parser;
    private final boolean analyzeMode;
    private final Duration fetchTimeout;
    private final int maxAttempts;
    private final Duration retryBackoff;
    private final Ticker ticker;
    private final ThreadPoolExecutor executor;

    private final AsyncCache<String, ExecutionPlan> plans;
    private final Cache<String, FailedFetch> failures;
    private volatile BiConsumer<String, ExecutionPlan> planListener = (fingerprint, plan) -> { };

    public ExecutionPlanAnalyzer(PlanFetcher fetcher,
                                 boolean analyzeMode,
                                 Duration fetchTimeout,
                                 int workers,
                                 int queueCapacity) {
        this(fetcher, analyzeMode, fetchTimeout, workers, queueCapacity, DEFAULT_MAX_ATTEMPTS, DEFAULT_RETRY_BACKOFF);
    }

    public ExecutionPlanAnalyzer(PlanFetcher fetcher,
                                 boolean analyzeMode,
                                 Duration fetchTimeout,
                                 int workers,
                                 int queueCapacity,
                                 int maxAttempts,
                                 Duration retryBackoff) {
        this(fetcher, analyzeMode, fetchTimeout, workers, queueCapacity, maxAttempts, retryBackoff,
                Ticker.systemTicker());
    }

    ExecutionPlanAnalyzer(PlanFetcher fetcher,
                          boolean analyzeMode,
                          Duration fetchTimeout,
                          int workers,
                          int queueCapacity,
                          int maxAttempts,
                          Duration retryBackoff,
                          Ticker ticker) {
        this.fetcher = fetcher;
        this.parser = new ExecutionPlanParser();
        this.analyzeMode = analyzeMode;
        this.fetchTimeout = fetchTimeout;
        this.maxAttempts = maxAttempts;
        this.retryBackoff = retryBackoff;
        this.ticker = ticker;
        this.executor = new ThreadPoolExecutor(workers, workers, 30, TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(queueCapacity), new PlanWorkerThreadFactory(),
                new ThreadPoolExecutor.AbortPolicy());
        this.executor.allowCoreThreadTimeOut(true);

        this.plans = Caffeine.newBuilder()
                .executor(Runnable::run)
                .buildAsync();
        this.failures = Caffeine.newBuilder()
                .maximumSize(MAX_FAILURE_RECORDS)
                .executor(Runnable::run)
                .build();

        log.info("Plan analyzer started: workers={}, queue={}, timeout={}ms, mode={}, attempts={}, backoff={}ms",
                workers, queueCapacity, fetchTimeout.toMillis(), analyzeMode ? "EXPLAIN ANALYZE" : "EXPLAIN",
                maxAttempts, retryBackoff.toMillis());
    }

    public void setPlanListener(BiConsumer<String, ExecutionPlan> planListener) {
        this.planListener = planListener != null ? planListener : (fingerprint, plan) -> { };
    }

    /**
     * Requests the plan for a fingerprint without blocking. The future completes with the
     * cached plan, the result of a fetch already running, or the result of a new fetch.
     * It completes empty at once while the fingerprint is backing off after failures.
     * It never completes exceptionally.
     */
    public CompletableFuture<Optional<ExecutionPlan>> analyzeAsync(String fingerprint, String sql) {
        CompletableFuture<ExecutionPlan> existing = plans.getIfPresent(fingerprint);
        if (existing != null) {
            if (!existing.isDone() || hasPlan(existing)) {
                return toOptional(existing);
            }
            // an empty result whose removal has not run yet
            plans.asMap().remove(fingerprint, existing);
        }

        FailedFetch failure = failures.getIfPresent(fingerprint);
        if (failure != null && !isRetryDue(failure)) {
            log.debug("Skipping plan fetch for {} after {} failed attempts", fingerprint, failure.attempts());
            return CompletableFuture.completedFuture(Optional.empty());
        }

        return toOptional(plans.get(fingerprint, (key, cacheExecutor) -> submitFetch(key, sql)));
    }

    /**
     * Requests the plan and waits at most the fetch timeout for it.
     */
    public Optional<ExecutionPlan> analyze(String fingerprint, String sql) {
        try {
            return analyzeAsync(fingerprint, sql).get(fetchTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Timed out waiting {}ms for plan of {}", fetchTimeout.toMillis(), fingerprint);
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        } catch (ExecutionException e) {
            log.warn("Plan analysis for {} failed: {}", fingerprint, e.getCause().getMessage());
            return Optional.empty();
        }
    }

    /**
     * Waits until every fetch that is queued or running has finished.
     *
     * @return true if nothing was pending when the wait ended
     */
    public boolean awaitPending(Duration timeout) {
        List<CompletableFuture<ExecutionPlan>> pending = pendingFetches();
        if (pending.isEmpty()) {
            return true;
        }

        try {
            CompletableFuture.allOf(pending.toArray(new CompletableFuture[0]))
                    .get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("{} plan analyses still pending after {}ms", pendingFetches().size(), timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException e) {
            log.warn("Pending plan analysis failed: {}", e.getCause().getMessage());
        }
        return pendingFetches().isEmpty();
    }

    public Optional<ExecutionPlan> getCachedPlan(String fingerprint) {
        CompletableFuture<ExecutionPlan> future = plans.getIfPresent(fingerprint);
        return future != null && hasPlan(future) ? Optional.of(future.join()) : Optional.empty();
    }

    public Map<String, ExecutionPlan> getCachedPlans() {
        Map<String, ExecutionPlan> cached = new HashMap<>();
        plans.asMap().forEach((fingerprint, future) -> {
            if (hasPlan(future)) {
                cached.put(fingerprint, future.join());
            }
        });
        return Map.copyOf(cached);
    }

    public boolean isInFlight(String fingerprint) {
        CompletableFuture<ExecutionPlan> future = plans.getIfPresent(fingerprint);
        return future != null && !future.isDone();
    }

    /**
     * Number of failed fetches remembered for a fingerprint.
     */
    public int failedAttempts(String fingerprint) {
        FailedFetch failure = failures.getIfPresent(fingerprint);
        return failure != null ? failure.attempts() : 0;
    }

    public void evict(String fingerprint) {
        plans.synchronous().invalidate(fingerprint);
        failures.invalidate(fingerprint);
        log.debug("Evicted plan state for {}", fingerprint);
    }

    public int cachedPlanCount() {
        return getCachedPlans().size();
    }

    public void clear() {
        plans.synchronous().invalidateAll();
        failures.invalidateAll();
    }

    @Override
    public void close() {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(fetchTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Plan analysis workers did not stop within {}ms", fetchTimeout.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        // queued tasks dropped by shutdownNow never complete their futures
        for (CompletableFuture<ExecutionPlan> future : pendingFetches()) {
            future.complete(null);
        }
        log.info("Plan analyzer stopped with {} cached plans", cachedPlanCount());
    }

    private CompletableFuture<ExecutionPlan> submitFetch(String fingerprint, String sql) {
        try {
            return CompletableFuture.supplyAsync(() -> fetchAndParse(fingerprint, sql), executor);
        } catch (RejectedExecutionException e) {
            log.warn("Plan analysis queue full, skipping fingerprint {} for now", fingerprint);
            return CompletableFuture.completedFuture(null);
        }
    }

    private ExecutionPlan fetchAndParse(String fingerprint, String sql) {
        try {
            long start = System.nanoTime();
            JsonNode explainOutput = fetcher.explain(sql, analyzeMode, fetchTimeout);
            double elapsedMs = (System.nanoTime() - start) / 1_000_000.0;

            ExecutionPlan plan = parser.parse(fingerprint, explainOutput, elapsedMs);
            failures.invalidate(fingerprint);
            log.debug("Cached plan for {} (cost {}, {} recommendations)",
                    fingerprint, plan.getTotalCost(), plan.getRecommendations().size());

            notifyListener(fingerprint, plan);
            return plan;
        } catch (PlanFetchException e) {
            recordFailure(fingerprint, e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Unexpected error analyzing plan for {}", fingerprint, e);
            recordFailure(fingerprint, e.toString());
        }
        return null;
    }

    private void recordFailure(String fingerprint, String reason) {
        long now = ticker.read();
        FailedFetch failure = failures.asMap().merge(fingerprint, new FailedFetch(1, now),
                (previous, latest) -> new FailedFetch(previous.attempts() + 1, now));

        if (failure.attempts() >= maxAttempts) {
            log.warn("Could not analyze plan for {} (attempt {}/{}), giving up: {}",
                    fingerprint, failure.attempts(), maxAttempts, reason);
        } else {
            log.warn("Could not analyze plan for {} (attempt {}/{}), retrying in {}ms: {}",
                    fingerprint, failure.attempts(), maxAttempts, backoffFor(failure).toMillis(), reason);
        }
    }

    private boolean isRetryDue(FailedFetch failure) {
        if (failure.attempts() >= maxAttempts) {
            return false;
        }
        return ticker.read() - failure.lastFailureNanos() >= backoffFor(failure).toNanos();
    }

    private Duration backoffFor(FailedFetch failure) {
        int doublings = Math.min(failure.attempts() - 1, MAX_BACKOFF_DOUBLINGS);
        return retryBackoff.multipliedBy(1L << doublings);
    }

    private List<CompletableFuture<ExecutionPlan>> pendingFetches() {
        return plans.asMap().values().stream()
                .filter(future -> !future.isDone())
                .collect(Collectors.toList());
    }

    private void notifyListener(String fingerprint, ExecutionPlan plan) {
        try {
            planListener.accept(fingerprint, plan);
        } catch (RuntimeException e) {
            log.warn("Plan listener failed for {}", fingerprint, e);
        }
    }

    private static boolean hasPlan(CompletableFuture<ExecutionPlan> future) {
        return future.isDone() && !future.isCompletedExceptionally() && future.getNow(null) != null;
    }

    private static CompletableFuture<Optional<ExecutionPlan>> toOptional(CompletableFuture<ExecutionPlan> future) {
        return future.handle((plan, error) -> Optional.ofNullable(error == null ? plan : null));
    }

    private record FailedFetch(int attempts, long lastFailureNanos) {
    }

    private static class PlanWorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "querylens-plan-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
