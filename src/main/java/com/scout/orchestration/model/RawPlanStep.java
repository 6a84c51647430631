package com.scout.orchestration.model;

/**
 * A plan step exactly as the planner produced it. Either field may be missing or blank.
 */
public record RawPlanStep(
        String subquery,
        String intent
) {
}
