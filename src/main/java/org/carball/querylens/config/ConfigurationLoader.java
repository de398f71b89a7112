package org.carball.querylens.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

@Slf4j
public class ConfigurationLoader {

    static final String ENV_PREFIX = "QUERYLENS_";
    static final String CLI_PREFIX = "--config.";

    private final Map<String, String> environment;

    public ConfigurationLoader() {
        this(System.getenv());
    }

    ConfigurationLoader(Map<String, String> environment) {
        this.environment = environment;
    }

    /**
     * Loads configuration using the hierarchy: CLI args > env vars > YAML file > defaults.
     */
    public AnalysisConfig loadConfiguration(Path yamlFile, String[] args) throws IOException {
        log.debug("Loading configuration");

        AnalysisConfig base = yamlFile != null ? loadYaml(yamlFile) : AnalysisConfig.defaults();
        AnalysisConfig.AnalysisConfigBuilder builder = base.toBuilder();

        applyEnvironmentVariables(builder);
        applyCLIArguments(builder, args);

        AnalysisConfig config = builder.build();
        config.validate();

        log.info("Configuration loaded: {}", config.getConfigurationSummary());
        return config;
    }

    /**
     * Reads a YAML file with snake_case keys; keys that are absent keep their defaults.
     */
    public AnalysisConfig loadYaml(Path yamlFile) throws IOException {
        if (!Files.exists(yamlFile)) {
            throw new IOException("Configuration file not found: " + yamlFile);
        }

        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        AnalysisConfig config = mapper.readValue(yamlFile.toFile(), AnalysisConfig.class);
        log.info("Loaded analysis configuration from: {}", yamlFile);
        return config;
    }

    private void applyEnvironmentVariables(AnalysisConfig.AnalysisConfigBuilder builder) {
        for (Map.Entry<String, String> entry : environment.entrySet()) {
            if (entry.getKey().startsWith(ENV_PREFIX)) {
                String key = entry.getKey().substring(ENV_PREFIX.length()).toLowerCase();
                apply(builder, key, entry.getValue(), entry.getKey());
            }
        }
    }

    private void applyCLIArguments(AnalysisConfig.AnalysisConfigBuilder builder, String[] args) {
        if (args == null) {
            return;
        }

        for (int i = 0; i < args.length - 1; i++) {
            String arg = args[i];
            if (arg.startsWith(CLI_PREFIX)) {
                String key = arg.substring(CLI_PREFIX.length()).replace('-', '_');
                apply(builder, key, args[i + 1], arg);
                i++;
            }
        }
    }

    private void apply(AnalysisConfig.AnalysisConfigBuilder builder, String key, String value, String source) {
        try {
            switch (key) {
                case "slow_query_threshold_ms":
                    builder.slowQueryThresholdMs(Long.parseLong(value.trim()));
                    break;
                case "n_plus_one_threshold":
                    builder.nPlusOneThreshold(Integer.parseInt(value.trim()));
                    break;
                case "n_plus_one_window_size":
                    builder.nPlusOneWindowSize(Integer.parseInt(value.trim()));
                    break;
                case "analysis_window_minutes":
                    builder.analysisWindowMinutes(Integer.parseInt(value.trim()));
                    break;
                case "max_analyzed_queries":
                    builder.maxAnalyzedQueries(Integer.parseInt(value.trim()));
                    break;
                case "max_sequence_entries":
                    builder.maxSequenceEntries(Integer.parseInt(value.trim()));
                    break;
                case "sample_text_max_length":
                    builder.sampleTextMaxLength(Integer.parseInt(value.trim()));
                    break;
                case "enable_explain_analyze":
                    builder.enableExplainAnalyze(Boolean.parseBoolean(value.trim()));
                    break;
                case "cache_execution_plans":
                    builder.cacheExecutionPlans(Boolean.parseBoolean(value.trim()));
                    break;
                case "max_concurrent_plan_analyses":
                    builder.maxConcurrentPlanAnalyses(Integer.parseInt(value.trim()));
                    break;
                case "plan_analysis_queue_capacity":
                    builder.planAnalysisQueueCapacity(Integer.parseInt(value.trim()));
                    break;
                case "plan_fetch_timeout_ms":
                    builder.planFetchTimeoutMs(Long.parseLong(value.trim()));
                    break;
                case "max_plan_fetch_attempts":
                    builder.maxPlanFetchAttempts(Integer.parseInt(value.trim()));
                    break;
                case "plan_retry_backoff_ms":
                    builder.planRetryBackoffMs(Long.parseLong(value.trim()));
                    break;
                default:
                    log.warn("Ignoring unknown configuration key from {}", source);
            }
        } catch (NumberFormatException e) {
            log.warn("Invalid numeric value for {}: {}", source, value);
        }
    }

    /**
     * Returns help text for configuration options.
     */
    public static String getConfigurationHelp() {
        return """
            Configuration Options:

            CLI Arguments:
              --config.slow-query-threshold-ms <ms>       Average duration that marks a query as slow (1000)
              --config.n-plus-one-threshold <num>         Repetitions inside one window that flag N+1 (10)
              --config.n-plus-one-window-size <num>       Consecutive statements per detection window (50)
              --config.analysis-window-minutes <min>      How long occurrences are kept for N+1 detection (60)
              --config.max-analyzed-queries <num>         Distinct fingerprints kept before eviction (100)
              --config.max-sequence-entries <num>         Hard cap on the occurrence log (10000)
              --config.enable-explain-analyze <bool>      Use EXPLAIN ANALYZE instead of EXPLAIN (false)
              --config.cache-execution-plans <bool>       Fetch and cache one plan per fingerprint (true)
              --config.max-concurrent-plan-analyses <n>   Parallel plan fetches (2)
              --config.plan-analysis-queue-capacity <n>   Pending plan fetches before new ones are dropped (100)
              --config.plan-fetch-timeout-ms <ms>         Timeout for a single plan fetch (5000)
              --config.max-plan-fetch-attempts <n>        Failed fetches before a fingerprint is given up (3)
              --config.plan-retry-backoff-ms <ms>         Wait before the first retry, doubled per failure (60000)

            Environment Variables:
              QUERYLENS_<KEY>                             Same keys in upper case, e.g. QUERYLENS_SLOW_QUERY_THRESHOLD_MS

            YAML File (--config <file>):
              snake_case keys, e.g. slow_query_threshold_ms: 500

            Priority Order (highest to lowest):
              1. CLI arguments
              2. Environment variables
              3. YAML file
              4. Built-in defaults
            """;
    }
}
