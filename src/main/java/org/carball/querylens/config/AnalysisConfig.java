package org.carball.querylens.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;
import lombok.extern.jackson.Jacksonized;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Tunables for the analysis engine. Every field has a default; YAML files, environment
 * variables and CLI arguments override them through {@link ConfigurationLoader}.
 */
@Data
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
@Slf4j
public class AnalysisConfig {

    // Query classification
    @Builder.Default
    @JsonProperty("slow_query_threshold_ms")
    private long slowQueryThresholdMs = 1000;

    @Builder.Default
    @JsonProperty("n_plus_one_threshold")
    private int nPlusOneThreshold = 10;

    @Builder.Default
    @JsonProperty("n_plus_one_window_size")
    private int nPlusOneWindowSize = 50;

    // Retention
    @Builder.Default
    @JsonProperty("analysis_window_minutes")
    private int analysisWindowMinutes = 60;

    @Builder.Default
    @JsonProperty("max_analyzed_queries")
    private int maxAnalyzedQueries = 100;

    @Builder.Default
    @JsonProperty("max_sequence_entries")
    private int maxSequenceEntries = 10_000;

    @Builder.Default
    @JsonProperty("sample_text_max_length")
    private int sampleTextMaxLength = 500;

    // Execution plans
    @Builder.Default
    @JsonProperty("enable_explain_analyze")
    private boolean enableExplainAnalyze = false;

    @Builder.Default
    @JsonProperty("cache_execution_plans")
    private boolean cacheExecutionPlans = true;

    @Builder.Default
    @JsonProperty("max_concurrent_plan_analyses")
    private int maxConcurrentPlanAnalyses = 2;

    @Builder.Default
    @JsonProperty("plan_analysis_queue_capacity")
    private int planAnalysisQueueCapacity = 100;

    @Builder.Default
    @JsonProperty("plan_fetch_timeout_ms")
    private long planFetchTimeoutMs = 5000;

    @Builder.Default
    @JsonProperty("max_plan_fetch_attempts")
    private int maxPlanFetchAttempts = 3;

    @Builder.Default
    @JsonProperty("plan_retry_backoff_ms")
    private long planRetryBackoffMs = 60_000;

    /**
     * Creates the default configuration.
     */
    public static AnalysisConfig defaults() {
        return AnalysisConfig.builder().build();
    }

    public Duration getAnalysisWindow() {
        return Duration.ofMinutes(analysisWindowMinutes);
    }

    public Duration getPlanFetchTimeout() {
        return Duration.ofMillis(planFetchTimeoutMs);
    }

    public Duration getPlanRetryBackoff() {
        return Duration.ofMillis(planRetryBackoffMs);
    }

    /**
     * Rejects values the engine cannot run with and logs warnings for values that are
     * legal but probably unintended.
     */
    public void validate() {
        requirePositive("n_plus_one_threshold", nPlusOneThreshold);
        requirePositive("n_plus_one_window_size", nPlusOneWindowSize);
        requirePositive("analysis_window_minutes", analysisWindowMinutes);
        requirePositive("max_analyzed_queries", maxAnalyzedQueries);
        requirePositive("max_sequence_entries", maxSequenceEntries);
        requirePositive("sample_text_max_length", sampleTextMaxLength);
        requirePositive("max_concurrent_plan_analyses", maxConcurrentPlanAnalyses);
        requirePositive("plan_analysis_queue_capacity", planAnalysisQueueCapacity);
        requirePositive("plan_fetch_timeout_ms", planFetchTimeoutMs);
        requirePositive("max_plan_fetch_attempts", maxPlanFetchAttempts);

        if (slowQueryThresholdMs < 0) {
            throw new IllegalArgumentException("slow_query_threshold_ms must not be negative: " + slowQueryThresholdMs);
        }

        if (planRetryBackoffMs < 0) {
            throw new IllegalArgumentException("plan_retry_backoff_ms must not be negative: " + planRetryBackoffMs);
        }

        if (nPlusOneThreshold > nPlusOneWindowSize) {
            log.warn("N+1 threshold ({}) is larger than the detection window ({}); no pattern can ever be detected",
                    nPlusOneThreshold, nPlusOneWindowSize);
        }

        if (maxSequenceEntries < nPlusOneWindowSize) {
            log.warn("Sequence capacity ({}) is smaller than the detection window ({})",
                    maxSequenceEntries, nPlusOneWindowSize);
        }

        if (enableExplainAnalyze) {
            log.warn("EXPLAIN ANALYZE is enabled: analyzed statements are executed a second time by the plan analyzer");
        }

        log.debug("Using configuration: {}", getConfigurationSummary());
    }

    /**
     * Returns a one-line description of the active configuration.
     */
    public String getConfigurationSummary() {
        return String.format("slow=%dms | n+1 threshold=%d/%d | window=%dmin | max queries=%d | plans=%s%s | timeout=%dms",
                slowQueryThresholdMs, nPlusOneThreshold, nPlusOneWindowSize, analysisWindowMinutes,
                maxAnalyzedQueries, cacheExecutionPlans ? "cached" : "off",
                enableExplainAnalyze ? " (analyze)" : "", planFetchTimeoutMs);
    }

    private static void requirePositive(String name, long value) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive: " + value);
        }
    }
}
