package com.scout.orchestration.model;

import java.util.List;

public record OrchestrationResult(
        String answer,
        ExecutionPlan plan,
        List<StepResult> results,
        boolean cancelled
) {

    public OrchestrationResult {
        results = results == null ? List.of() : List.copyOf(results);
    }
}
