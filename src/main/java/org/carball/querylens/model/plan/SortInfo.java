package org.carball.querylens.model.plan;

import java.util.List;

/**
 * Sort node found in an execution plan.
 */
public record SortInfo(List<String> keys, String method, double cost) {}
