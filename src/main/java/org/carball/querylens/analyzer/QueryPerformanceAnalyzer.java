package org.carball.querylens.analyzer;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.carball.querylens.config.AnalysisConfig;
import org.carball.querylens.model.analysis.NPlusOneDetection;
import org.carball.querylens.model.plan.ExecutionPlan;
import org.carball.querylens.model.query.NormalizedQuery;
import org.carball.querylens.model.query.QueryMetrics;
import org.carball.querylens.output.PerformanceReport;
import org.carball.querylens.parser.QueryNormalizer;
import org.carball.querylens.plan.PlanFetcher;

import java.io.PrintStream;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Entry point of the engine. Callers report executed statements; the analyzer fingerprints
 * them, keeps per-fingerprint statistics, fetches one execution plan per new fingerprint in
 * the background and assembles performance reports on demand.
 * <p>
 * Recording never throws. Without a {@link PlanFetcher} plan analysis is disabled.
 */
@Slf4j
public class QueryPerformanceAnalyzer implements AutoCloseable {

    public static final double INEFFICIENT_RATIO = 0.1;
    static final int REPORT_SLOW_LIMIT = 10;
    static final int REPORT_INEFFICIENT_LIMIT = 5;
    static final int REPORT_FREQUENT_LIMIT = 5;

    @Getter
    private final AnalysisConfig config;
    private final Clock clock;
    private final MetricsStore metricsStore;
    private final SequenceTracker sequenceTracker;
    private final NPlusOneDetector nPlusOneDetector;
    private final RecommendationEngine recommendationEngine;
    private final ExecutionPlanAnalyzer planAnalyzer;

    public QueryPerformanceAnalyzer(AnalysisConfig config) {
        this(config, null);
    }

    public QueryPerformanceAnalyzer(AnalysisConfig config, PlanFetcher planFetcher) {
        this(config, planFetcher, Clock.systemUTC());
    }

    public QueryPerformanceAnalyzer(AnalysisConfig config, PlanFetcher planFetcher, Clock clock) {
        this(config, planFetcher, clock, new RecommendationEngine(config.getSlowQueryThresholdMs()));
    }

    QueryPerformanceAnalyzer(AnalysisConfig config,
                             PlanFetcher planFetcher,
                             Clock clock,
                             RecommendationEngine recommendationEngine) {
        config.validate();
        this.config = config;
        this.clock = clock;
        this.metricsStore = new MetricsStore(config.getMaxAnalyzedQueries(), config.getSampleTextMaxLength());
        this.sequenceTracker = new SequenceTracker(config.getAnalysisWindow(), config.getMaxSequenceEntries());
        this.nPlusOneDetector = new NPlusOneDetector(config.getNPlusOneThreshold(), config.getNPlusOneWindowSize());
        this.recommendationEngine = recommendationEngine;

        if (planFetcher != null && config.isCacheExecutionPlans()) {
            this.planAnalyzer = new ExecutionPlanAnalyzer(planFetcher,
                    config.isEnableExplainAnalyze(),
                    config.getPlanFetchTimeout(),
                    config.getMaxConcurrentPlanAnalyses(),
                    config.getPlanAnalysisQueueCapacity(),
                    config.getMaxPlanFetchAttempts(),
                    config.getPlanRetryBackoff());
            this.planAnalyzer.setPlanListener(this::onPlanCached);
            this.metricsStore.setEvictionListener(planAnalyzer::evict);
        } else {
            this.planAnalyzer = null;
        }

        log.info("Query performance analyzer initialized ({}), plan analysis {}",
                config.getConfigurationSummary(), planAnalyzer != null ? "enabled" : "disabled");
    }

    public QueryMetrics recordQuery(String sql) {
        return recordQuery(sql, null, null);
    }

    public QueryMetrics recordQuery(String sql, Double durationMs, Long rowsReturned) {
        return recordQuery(sql, durationMs, rowsReturned, null);
    }

    /**
     * Records one executed statement. A null timestamp means now; an explicit one replays a
     * historical execution.
     *
     * @return the updated statistics, or null if the statement was blank or recording failed
     */
    public QueryMetrics recordQuery(String sql, Double durationMs, Long rowsReturned, Instant at) {
        if (sql == null || sql.isBlank()) {
            log.debug("Ignoring blank statement");
            return null;
        }

        try {
            Instant timestamp = at != null ? at : clock.instant();
            NormalizedQuery normalized = QueryNormalizer.normalize(sql);
            String fingerprint = normalized.fingerprint();

            QueryMetrics metrics = metricsStore.record(fingerprint, sql, durationMs, rowsReturned, timestamp);
            sequenceTracker.recordOccurrence(fingerprint, timestamp);

            if (durationMs != null && durationMs >= config.getSlowQueryThresholdMs()) {
                log.debug("Slow query {} took {}ms", fingerprint, durationMs);
            }

            if (normalized.explainable()) {
                requestPlan(fingerprint, sql);
            }
            return metrics;
        } catch (RuntimeException e) {
            log.warn("Failed to record query: {}", e.getMessage(), e);
            return null;
        }
    }

    private void requestPlan(String fingerprint, String sql) {
        if (planAnalyzer == null
                || planAnalyzer.getCachedPlan(fingerprint).isPresent()
                || planAnalyzer.isInFlight(fingerprint)) {
            return;
        }
        planAnalyzer.analyzeAsync(fingerprint, sql);
    }

    private void onPlanCached(String fingerprint, ExecutionPlan plan) {
        if (!metricsStore.applyPlan(fingerprint, plan) && metricsStore.get(fingerprint).isEmpty()) {
            // evicted while the plan was being fetched
            planAnalyzer.evict(fingerprint);
        }
    }

    /**
     * Looks for N+1 patterns among the occurrences still inside the analysis window.
     */
    public List<NPlusOneDetection> detectNPlusOne() {
        sequenceTracker.prune(clock.instant());
        return nPlusOneDetector.detect(sequenceTracker.snapshot(), metricsStore::get);
    }

    public List<QueryMetrics> getSlowQueries(int limit) {
        return metricsStore.slowQueries(config.getSlowQueryThresholdMs(), limit);
    }

    public List<QueryMetrics> getInefficientQueries(int limit) {
        return metricsStore.inefficientQueries(INEFFICIENT_RATIO, limit);
    }

    public List<QueryMetrics> getMostFrequentQueries(int limit) {
        return metricsStore.topByFrequency(limit);
    }

    public Optional<QueryMetrics> getQueryMetrics(String fingerprint) {
        return metricsStore.get(fingerprint);
    }

    public int getTrackedQueryCount() {
        return metricsStore.size();
    }

    public Optional<ExecutionPlan> getExecutionPlan(String fingerprint) {
        return planAnalyzer == null ? Optional.empty() : planAnalyzer.getCachedPlan(fingerprint);
    }

    public boolean isPlanAnalysisEnabled() {
        return planAnalyzer != null;
    }

    /**
     * Blocks until queued plan fetches are done or the timeout passes.
     *
     * @return true if no plan fetch is still pending
     */
    public boolean awaitPendingPlanAnalyses(Duration timeout) {
        return planAnalyzer == null || planAnalyzer.awaitPending(timeout);
    }

    /**
     * Builds a report from the current state. Each section is assembled independently; a
     * failing section is left empty and described in the report's error field.
     */
    public PerformanceReport buildReport() {
        PerformanceReport report = new PerformanceReport();
        List<String> errors = new ArrayList<>();

        List<NPlusOneDetection> detections = section("n_plus_one_patterns", this::detectNPlusOne, List.of(), errors);
        List<QueryMetrics> allMetrics = section("metrics", metricsStore::snapshot, List.of(), errors);
        List<ExecutionPlan> plans = section("execution_plans",
                () -> planAnalyzer == null ? List.<ExecutionPlan>of() : new ArrayList<ExecutionPlan>(planAnalyzer.getCachedPlans().values()),
                List.of(), errors);

        fill("analysis_summary", () -> {
            PerformanceReport.AnalysisSummary summary = report.getAnalysisSummary();
            summary.setTotalQueriesAnalyzed(allMetrics.size());
            summary.setAnalysisPeriodMinutes(config.getAnalysisWindowMinutes());
            summary.setSlowQueriesCount((int) allMetrics.stream()
                    .filter(m -> m.getAvgDurationMs() >= config.getSlowQueryThresholdMs())
                    .count());
            summary.setNPlusOnePatterns(detections.size());
            summary.setExecutionPlansCached(plans.size());
            summary.setGeneratedAt(clock.instant());
        }, errors);

        fill("slow_queries", () -> report.setSlowQueries(getSlowQueries(REPORT_SLOW_LIMIT).stream()
                .map(m -> PerformanceReport.SlowQuery.from(m, getExecutionPlan(m.getFingerprint())
                        .map(ExecutionPlan::getRecommendations)
                        .orElse(List.of())))
                .collect(Collectors.toList())), errors);

        fill("n_plus_one_patterns", () -> report.setNPlusOnePatterns(detections.stream()
                .map(PerformanceReport.NPlusOnePattern::from)
                .collect(Collectors.toList())), errors);

        fill("inefficient_queries", () -> report.setInefficientQueries(getInefficientQueries(REPORT_INEFFICIENT_LIMIT).stream()
                .map(PerformanceReport.InefficientQuery::from)
                .collect(Collectors.toList())), errors);

        fill("most_frequent_queries", () -> report.setMostFrequentQueries(getMostFrequentQueries(REPORT_FREQUENT_LIMIT).stream()
                .map(PerformanceReport.FrequentQuery::from)
                .collect(Collectors.toList())), errors);

        fill("optimization_recommendations", () -> report.setOptimizationRecommendations(
                recommendationEngine.generateRecommendations(allMetrics, plans, detections)), errors);

        if (!errors.isEmpty()) {
            report.setError(String.join("; ", errors));
        }

        log.info("Built performance report: {} queries, {} slow, {} N+1 patterns, {} plans",
                allMetrics.size(), report.getSlowQueries().size(), detections.size(), plans.size());
        return report;
    }

    private <T> T section(String name, Supplier<T> supplier, T fallback, List<String> errors) {
        try {
            return supplier.get();
        } catch (RuntimeException e) {
            log.error("Failed to build report section {}", name, e);
            errors.add(name + ": " + e.getMessage());
            return fallback;
        }
    }

    private void fill(String name, Runnable filler, List<String> errors) {
        section(name, () -> {
            filler.run();
            return null;
        }, null, errors);
    }

    public void printReport(PrintStream out) {
        out.print(buildReport().toText());
    }

    /**
     * Drops all statistics, cached plans and occurrences. Plan fetches already running may
     * still cache their result.
     */
    public void reset() {
        metricsStore.clear();
        sequenceTracker.clear();
        if (planAnalyzer != null) {
            planAnalyzer.clear();
        }
        log.info("🔄 Query analysis data reset");
    }

    @Override
    public void close() {
        if (planAnalyzer != null) {
            planAnalyzer.close();
        }
    }
}
