package org.carball.querylens.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.querylens.model.analysis.NPlusOneDetection;
import org.carball.querylens.model.plan.ExecutionPlan;
import org.carball.querylens.model.query.QueryMetrics;
import org.carball.querylens.parser.ExecutionPlanParser;
import org.carball.querylens.parser.QueryNormalizer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Workload-level advice derived from all tracked queries, cached plans and N+1 detections.
 * Per-plan advice lives on {@link ExecutionPlan#getRecommendations()}.
 */
@Slf4j
public class RecommendationEngine {

    static final double SLOW_QUERY_SHARE = 0.1;
    static final double SEQUENTIAL_SCAN_SHARE = 0.3;
    static final double NESTED_LOOP_SHARE = 0.2;

    private final double slowQueryThresholdMs;

    public RecommendationEngine(double slowQueryThresholdMs) {
        this.slowQueryThresholdMs = slowQueryThresholdMs;
    }

    public List<String> generateRecommendations(Collection<QueryMetrics> metrics,
                                                Collection<ExecutionPlan> plans,
                                                List<NPlusOneDetection> nPlusOnePatterns) {
        List<String> recommendations = new ArrayList<>();
        int tracked = metrics.size();

        long slowCount = metrics.stream()
                .filter(m -> m.getAvgDurationMs() >= slowQueryThresholdMs)
                .count();
        if (slowCount > Math.max(tracked, 1) * SLOW_QUERY_SHARE) {
            recommendations.add("High percentage of slow queries detected - review database indexing strategy");
        }

        if (!nPlusOnePatterns.isEmpty()) {
            recommendations.add("Found " + nPlusOnePatterns.size()
                    + " potential N+1 query patterns - implement bulk loading");
        }

        mostAccessedTable(metrics).ifPresent(table ->
                recommendations.add("Most accessed table: " + table + " - ensure optimal indexing"));

        int sequentialScans = 0;
        int nestedLoopPlans = 0;
        int expensiveSortPlans = 0;
        for (ExecutionPlan plan : plans) {
            sequentialScans += plan.getTableScans().size();
            if (plan.hasNestedLoopJoin()) {
                nestedLoopPlans++;
            }
            if (plan.hasExpensiveSort(ExecutionPlanParser.EXPENSIVE_SORT_COST)) {
                expensiveSortPlans++;
            }
        }

        if (sequentialScans > tracked * SEQUENTIAL_SCAN_SHARE) {
            recommendations.add("Many queries using sequential scans - add selective indexes");
        }
        if (nestedLoopPlans > tracked * NESTED_LOOP_SHARE) {
            recommendations.add("Many nested loop joins detected - optimize join conditions and indexes");
        }
        if (expensiveSortPlans > 0) {
            recommendations.add("Expensive sorts found in " + expensiveSortPlans
                    + " execution plans - consider indexes matching ORDER BY columns");
        }

        log.debug("Generated {} workload recommendations for {} queries and {} plans",
                recommendations.size(), tracked, plans.size());
        return recommendations;
    }

    /**
     * Table with the most executions across all queries that touch it. Ties go to the
     * alphabetically first table.
     */
    Optional<String> mostAccessedTable(Collection<QueryMetrics> metrics) {
        Map<String, Long> accessCounts = new TreeMap<>();
        for (QueryMetrics m : metrics) {
            for (String table : QueryNormalizer.extractTableNames(m.getSampleText())) {
                accessCounts.merge(table, m.getExecutionCount(), Long::sum);
            }
        }

        String best = null;
        long bestCount = -1;
        for (Map.Entry<String, Long> entry : accessCounts.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return Optional.ofNullable(best);
    }
}
