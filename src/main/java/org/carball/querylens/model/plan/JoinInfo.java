package org.carball.querylens.model.plan;

/**
 * Join node found in an execution plan. The condition is empty when the plan carries none.
 */
public record JoinInfo(String joinType, String condition, String nodeType) {

    public boolean hasCondition() {
        return condition != null && !condition.isBlank();
    }

    public boolean isNestedLoop() {
        return nodeType != null && nodeType.contains("Nested Loop");
    }
}
