package org.carball.querylens.parser;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.carball.querylens.model.plan.ExecutionPlan;
import org.carball.querylens.model.plan.JoinInfo;
import org.carball.querylens.model.plan.SortInfo;
import org.carball.querylens.plan.PlanFetchException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Flattens a PostgreSQL JSON plan into scans, joins and sorts and derives index and
 * query-shape advice from them.
 */
@Slf4j
public class ExecutionPlanParser {

    public static final double EXPENSIVE_SORT_COST = 1000.0;
    public static final double HIGH_TOTAL_COST = 10000.0;

    private static final String[] JOIN_CONDITION_FIELDS = {"Hash Cond", "Merge Cond", "Join Filter"};

    /**
     * Parses the plan returned for one fingerprint. Accepts the {@code [{"Plan": ...}]}
     * output of EXPLAIN, the {@code {"Plan": ...}} object, or a bare plan node.
     *
     * @throws PlanFetchException when no plan node can be found
     */
    public ExecutionPlan parse(String fingerprint, JsonNode explainOutput, double executionTimeMs)
            throws PlanFetchException {
        JsonNode root = locateRootNode(explainOutput);

        ExecutionPlan.ExecutionPlanBuilder builder = ExecutionPlan.builder()
                .fingerprint(fingerprint)
                .planTree(explainOutput)
                .executionTimeMs(executionTimeMs)
                .totalCost(root.path("Total Cost").asDouble(0.0))
                .rowsEstimated(root.path("Plan Rows").asLong(0))
                .rowsActual(root.path("Actual Rows").asLong(0))
                .analyzed(root.has("Actual Rows"));

        List<String> tableScans = new ArrayList<>();
        List<JoinInfo> joins = new ArrayList<>();
        List<SortInfo> sorts = new ArrayList<>();
        walk(root, builder, tableScans, joins, sorts);

        double totalCost = root.path("Total Cost").asDouble(0.0);
        for (String recommendation : recommend(tableScans, joins, sorts, totalCost)) {
            builder.recommendation(recommendation);
        }

        ExecutionPlan plan = builder.build();
        log.debug("Parsed plan for {}: cost={}, nodes={}, scans={}, joins={}, sorts={}",
                fingerprint, plan.getTotalCost(), plan.getNodeTypes().size(),
                tableScans.size(), joins.size(), sorts.size());
        return plan;
    }

    private JsonNode locateRootNode(JsonNode explainOutput) throws PlanFetchException {
        if (explainOutput == null || explainOutput.isMissingNode() || explainOutput.isNull()) {
            throw new PlanFetchException("Empty plan");
        }

        JsonNode node = explainOutput;
        if (node.isArray()) {
            if (node.isEmpty()) {
                throw new PlanFetchException("Empty plan array");
            }
            node = node.get(0);
        }
        if (node.has("Plan")) {
            node = node.get("Plan");
        }
        if (!node.isObject() || !node.hasNonNull("Node Type")) {
            throw new PlanFetchException("Malformed plan: root node has no 'Node Type'");
        }
        return node;
    }

    private void walk(JsonNode node,
                      ExecutionPlan.ExecutionPlanBuilder builder,
                      List<String> tableScans,
                      List<JoinInfo> joins,
                      List<SortInfo> sorts) {
        String nodeType = node.path("Node Type").asText("");
        builder.nodeType(nodeType);

        if (nodeType.contains("Seq Scan")) {
            String relation = node.path("Relation Name").asText("unknown");
            tableScans.add(relation);
            builder.tableScan(relation);
        } else if (nodeType.contains("Index")) {
            String relation = node.path("Relation Name").asText("unknown");
            String index = node.path("Index Name").asText("unknown");
            builder.indexScan(relation + "." + index);
        }

        if (nodeType.contains("Join") || nodeType.equals("Nested Loop")) {
            JoinInfo join = new JoinInfo(node.path("Join Type").asText(""), joinCondition(node), nodeType);
            joins.add(join);
            builder.join(join);
        }

        if (nodeType.contains("Sort")) {
            List<String> keys = new ArrayList<>();
            node.path("Sort Key").forEach(key -> keys.add(key.asText()));
            SortInfo sort = new SortInfo(List.copyOf(keys),
                    node.path("Sort Method").asText(""),
                    node.path("Total Cost").asDouble(0.0));
            sorts.add(sort);
            builder.sort(sort);
        }

        for (JsonNode child : node.path("Plans")) {
            walk(child, builder, tableScans, joins, sorts);
        }
    }

    private String joinCondition(JsonNode node) {
        for (String field : JOIN_CONDITION_FIELDS) {
            if (node.hasNonNull(field)) {
                return node.get(field).asText();
            }
        }
        return "";
    }

    List<String> recommend(List<String> tableScans, List<JoinInfo> joins, List<SortInfo> sorts, double totalCost) {
        List<String> recommendations = new ArrayList<>();

        for (String table : tableScans) {
            recommendations.add("Consider adding index on " + table + " - sequential scan detected");
        }

        for (SortInfo sort : sorts) {
            if (sort.cost() > EXPENSIVE_SORT_COST) {
                recommendations.add("Expensive sort on " + sort.keys() + " - consider index or query optimization");
            }
        }

        if (joins.stream().anyMatch(JoinInfo::isNestedLoop)) {
            recommendations.add("Nested loop joins detected - ensure proper indexes on join columns");
        }

        if (totalCost > HIGH_TOTAL_COST) {
            recommendations.add(String.format(Locale.ROOT,
                    "High total cost (%.0f) - consider query restructuring", totalCost));
        }

        boolean unconditionedJoin = joins.stream()
                .filter(join -> join.nodeType().contains("Hash") || join.nodeType().contains("Merge"))
                .anyMatch(join -> !join.hasCondition());
        if (unconditionedJoin) {
            recommendations.add("Join without proper condition detected - check join logic");
        }

        return recommendations;
    }
}
