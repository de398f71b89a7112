package org.carball.querylens.model.plan;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Parsed execution plan for one fingerprint with the advice derived from its structure.
 */
@Value
@Builder
public class ExecutionPlan {
    String fingerprint;
    JsonNode planTree;
    double totalCost;
    double executionTimeMs;
    long rowsEstimated;
    long rowsActual;
    boolean analyzed;
    @Singular
    List<String> nodeTypes;
    @Singular
    List<String> tableScans;
    @Singular
    List<String> indexScans;
    @Singular
    List<JoinInfo> joins;
    @Singular
    List<SortInfo> sorts;
    @Singular
    List<String> recommendations;

    /**
     * Rows a single execution is expected to touch: actual rows when the plan was
     * produced by EXPLAIN ANALYZE, the planner estimate otherwise.
     */
    public long getRowsExamined() {
        return analyzed ? rowsActual : rowsEstimated;
    }

    public boolean hasNestedLoopJoin() {
        return joins.stream().anyMatch(JoinInfo::isNestedLoop);
    }

    public boolean hasExpensiveSort(double costThreshold) {
        return sorts.stream().anyMatch(sort -> sort.cost() > costThreshold);
    }
}
