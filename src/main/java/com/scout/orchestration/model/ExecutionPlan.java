package com.scout.orchestration.model;

import java.util.List;

/**
 * Ordered steps of one orchestration call. List order is execution order.
 */
public record ExecutionPlan(
        List<PlanStep> steps
) {

    public ExecutionPlan {
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    public int size() {
        return steps.size();
    }

    public PlanStep step(int index) {
        return steps.get(index);
    }
}
