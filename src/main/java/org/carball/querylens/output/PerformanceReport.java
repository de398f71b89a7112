package org.carball.querylens.output;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.carball.querylens.model.analysis.NPlusOneDetection;
import org.carball.querylens.model.query.QueryMetrics;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Point-in-time performance report. Serializes to JSON with snake_case keys and renders a
 * console version with the same sections.
 */
@Data
@Slf4j
public class PerformanceReport {

    public static final int PREVIEW_LENGTH = 100;
    private static final String SEPARATOR = "=".repeat(80);
    private static final String RULE = "-".repeat(60);

    @JsonProperty("analysis_summary")
    private AnalysisSummary analysisSummary = new AnalysisSummary();

    @JsonProperty("slow_queries")
    private List<SlowQuery> slowQueries = new ArrayList<>();

    @JsonProperty("n_plus_one_patterns")
    private List<NPlusOnePattern> nPlusOnePatterns = new ArrayList<>();

    @JsonProperty("inefficient_queries")
    private List<InefficientQuery> inefficientQueries = new ArrayList<>();

    @JsonProperty("most_frequent_queries")
    private List<FrequentQuery> mostFrequentQueries = new ArrayList<>();

    @JsonProperty("optimization_recommendations")
    private List<String> optimizationRecommendations = new ArrayList<>();

    @JsonProperty("error")
    private String error;

    public String toJson() {
        try {
            return createObjectMapper().writeValueAsString(this);
        } catch (JsonProcessingException e) {
            log.error("Error generating JSON report", e);
            throw new IllegalStateException("Failed to generate JSON report", e);
        }
    }

    static ObjectMapper createObjectMapper() {
        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        // Lombok getters such as getNPlusOnePatterns() do not match their field names
        objectMapper.setVisibility(PropertyAccessor.GETTER, JsonAutoDetect.Visibility.NONE);
        objectMapper.setVisibility(PropertyAccessor.IS_GETTER, JsonAutoDetect.Visibility.NONE);
        objectMapper.setVisibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY);
        return objectMapper;
    }

    public String toText() {
        StringBuilder out = new StringBuilder();

        out.append('\n').append(SEPARATOR).append('\n');
        out.append("📊 QUERY PERFORMANCE ANALYSIS REPORT\n");
        out.append(SEPARATOR).append('\n');

        AnalysisSummary summary = analysisSummary;
        out.append("📈 Total Queries Analyzed: ").append(summary.getTotalQueriesAnalyzed()).append('\n');
        out.append("⏰ Analysis Period: ").append(summary.getAnalysisPeriodMinutes()).append(" minutes\n");
        out.append("🐌 Slow Queries: ").append(summary.getSlowQueriesCount()).append('\n');
        out.append("🔄 N+1 Patterns: ").append(summary.getNPlusOnePatterns()).append('\n');
        out.append("📋 Execution Plans: ").append(summary.getExecutionPlansCached()).append('\n');

        if (!slowQueries.isEmpty()) {
            out.append("\n🐌 TOP SLOW QUERIES:\n").append(RULE).append('\n');
            int i = 1;
            for (SlowQuery query : slowQueries.subList(0, Math.min(5, slowQueries.size()))) {
                out.append(i++).append(". Query: ").append(query.getQueryPreview()).append('\n');
                out.append("   Avg Duration: ").append(query.getAvgDurationMs()).append("ms\n");
                out.append("   Executions: ").append(query.getExecutionCount()).append('\n');
                out.append("   Performance Score: ").append(query.getPerformanceScore()).append("/100\n");
                if (!query.getRecommendations().isEmpty()) {
                    List<String> top = query.getRecommendations()
                            .subList(0, Math.min(2, query.getRecommendations().size()));
                    out.append("   Recommendations: ").append(String.join(", ", top)).append('\n');
                }
                out.append('\n');
            }
        }

        if (!nPlusOnePatterns.isEmpty()) {
            out.append("\n🔄 N+1 QUERY PATTERNS:\n").append(RULE).append('\n');
            int i = 1;
            for (NPlusOnePattern pattern : nPlusOnePatterns) {
                out.append(i++).append(". Pattern: ").append(pattern.getRepeatedQueryPreview()).append('\n');
                out.append("   Occurrences: ").append(pattern.getOccurrenceCount()).append('\n');
                out.append("   Total Duration: ").append(pattern.getTotalDurationMs()).append("ms\n");
                out.append("   Tables: ").append(String.join(", ", pattern.getAffectedTables())).append('\n');
                out.append("   Solution: ").append(pattern.getSuggestedSolution()).append('\n');
                out.append("   Confidence: ").append(pattern.getConfidenceScore()).append('\n');
                out.append('\n');
            }
        }

        if (!inefficientQueries.isEmpty()) {
            out.append("\n🔍 INEFFICIENT QUERIES:\n").append(RULE).append('\n');
            int i = 1;
            for (InefficientQuery query : inefficientQueries) {
                out.append(i++).append(". Query: ").append(query.getQueryPreview()).append('\n');
                out.append("   Efficiency: ").append(query.getEfficiencyRatio())
                        .append(" (").append(query.rowsReturnedPerExecution()).append(" returned / ")
                        .append(query.getRowsExamined()).append(" examined per run)\n");
            }
        }

        if (!mostFrequentQueries.isEmpty()) {
            out.append("\n🔁 MOST FREQUENT QUERIES:\n").append(RULE).append('\n');
            int i = 1;
            for (FrequentQuery query : mostFrequentQueries) {
                out.append(i++).append(". Query: ").append(query.getQueryPreview()).append('\n');
                out.append("   Executions: ").append(query.getExecutionCount())
                        .append(", avg ").append(query.getAvgDurationMs()).append("ms")
                        .append(", total ").append(query.getTotalDurationMs()).append("ms\n");
            }
        }

        if (!optimizationRecommendations.isEmpty()) {
            out.append("\n💡 OPTIMIZATION RECOMMENDATIONS:\n").append(RULE).append('\n');
            int i = 1;
            for (String recommendation : optimizationRecommendations) {
                out.append(i++).append(". ").append(recommendation).append('\n');
            }
        }

        if (error != null) {
            out.append("\n⚠️  Report incomplete: ").append(error).append('\n');
        }

        out.append(SEPARATOR).append('\n');
        return out.toString();
    }

    /**
     * Single-line preview of a statement, at most {@value #PREVIEW_LENGTH} characters.
     */
    public static String preview(String sql) {
        if (sql == null) {
            return "";
        }
        String collapsed = sql.replaceAll("\\s+", " ").trim();
        if (collapsed.length() <= PREVIEW_LENGTH) {
            return collapsed;
        }
        return collapsed.substring(0, PREVIEW_LENGTH - 3) + "...";
    }

    static double round(double value, int places) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale(places, RoundingMode.HALF_UP).doubleValue();
    }

    @Data
    public static class AnalysisSummary {
        @JsonProperty("total_queries_analyzed")
        private int totalQueriesAnalyzed;

        @JsonProperty("analysis_period_minutes")
        private int analysisPeriodMinutes;

        @JsonProperty("slow_queries_count")
        private int slowQueriesCount;

        @JsonProperty("n_plus_one_patterns")
        private int nPlusOnePatterns;

        @JsonProperty("execution_plans_cached")
        private int executionPlansCached;

        @JsonProperty("generated_at")
        private Instant generatedAt;
    }

    @Data
    public static class SlowQuery {
        @JsonProperty("query_hash")
        private String queryHash;

        @JsonProperty("query_preview")
        private String queryPreview;

        @JsonProperty("avg_duration_ms")
        private double avgDurationMs;

        @JsonProperty("execution_count")
        private long executionCount;

        @JsonProperty("performance_score")
        private double performanceScore;

        @JsonProperty("recommendations")
        private List<String> recommendations = new ArrayList<>();

        public static SlowQuery from(QueryMetrics metrics, List<String> planRecommendations) {
            SlowQuery entry = new SlowQuery();
            entry.setQueryHash(metrics.getFingerprint());
            entry.setQueryPreview(preview(metrics.getSampleText()));
            entry.setAvgDurationMs(round(metrics.getAvgDurationMs(), 2));
            entry.setExecutionCount(metrics.getExecutionCount());
            entry.setPerformanceScore(round(metrics.getPerformanceScore(), 1));
            entry.setRecommendations(new ArrayList<>(planRecommendations));
            return entry;
        }
    }

    @Data
    public static class NPlusOnePattern {
        @JsonProperty("query_hash")
        private String queryHash;

        @JsonProperty("repeated_query_preview")
        private String repeatedQueryPreview;

        @JsonProperty("occurrence_count")
        private int occurrenceCount;

        @JsonProperty("total_duration_ms")
        private double totalDurationMs;

        @JsonProperty("affected_tables")
        private List<String> affectedTables = new ArrayList<>();

        @JsonProperty("suggested_solution")
        private String suggestedSolution;

        @JsonProperty("confidence_score")
        private double confidenceScore;

        public static NPlusOnePattern from(NPlusOneDetection detection) {
            NPlusOnePattern entry = new NPlusOnePattern();
            entry.setQueryHash(detection.getRepeatedFingerprint());
            entry.setRepeatedQueryPreview(preview(detection.getRepeatedQuery()));
            entry.setOccurrenceCount(detection.getOccurrenceCount());
            entry.setTotalDurationMs(round(detection.getTotalDurationMs(), 2));
            entry.setAffectedTables(new ArrayList<>(detection.getAffectedTables()));
            entry.setSuggestedSolution(detection.getSuggestedSolution());
            entry.setConfidenceScore(round(detection.getConfidenceScore(), 2));
            return entry;
        }
    }

    @Data
    public static class InefficientQuery {
        @JsonProperty("query_hash")
        private String queryHash;

        @JsonProperty("query_preview")
        private String queryPreview;

        @JsonProperty("efficiency_ratio")
        private double efficiencyRatio;

        @JsonProperty("rows_examined")
        private long rowsExamined;

        @JsonProperty("rows_returned")
        private long rowsReturned;

        @JsonProperty("execution_count")
        private long executionCount;

        public static InefficientQuery from(QueryMetrics metrics) {
            InefficientQuery entry = new InefficientQuery();
            entry.setQueryHash(metrics.getFingerprint());
            entry.setQueryPreview(preview(metrics.getSampleText()));
            entry.setEfficiencyRatio(round(metrics.getEfficiencyRatio(), 3));
            entry.setRowsExamined(metrics.getRowsExamined());
            entry.setRowsReturned(metrics.getRowsReturned());
            entry.setExecutionCount(metrics.getExecutionCount());
            return entry;
        }

        /**
         * Rows returned accumulate over executions; rows examined come from one plan.
         */
        public double rowsReturnedPerExecution() {
            return round((double) rowsReturned / Math.max(executionCount, 1), 2);
        }
    }

    @Data
    public static class FrequentQuery {
        @JsonProperty("query_hash")
        private String queryHash;

        @JsonProperty("query_preview")
        private String queryPreview;

        @JsonProperty("execution_count")
        private long executionCount;

        @JsonProperty("avg_duration_ms")
        private double avgDurationMs;

        @JsonProperty("total_duration_ms")
        private double totalDurationMs;

        public static FrequentQuery from(QueryMetrics metrics) {
            FrequentQuery entry = new FrequentQuery();
            entry.setQueryHash(metrics.getFingerprint());
            entry.setQueryPreview(preview(metrics.getSampleText()));
            entry.setExecutionCount(metrics.getExecutionCount());
            entry.setAvgDurationMs(round(metrics.getAvgDurationMs(), 2));
            entry.setTotalDurationMs(round(metrics.getTotalDurationMs(), 2));
            return entry;
        }
    }
}
