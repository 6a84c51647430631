package com.scout.api;

import com.scout.orchestration.model.OrchestrationResult;
import com.scout.orchestration.model.PlanStep;
import com.scout.orchestration.model.StepResult;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record AskResponse(
        String requestId,
        String runId,
        Instant createdAt,
        String answer,
        List<PlanStep> plan,
        List<StepResult> results,
        boolean cancelled
) {

    public static AskResponse from(String runId, OrchestrationResult result) {
        return new AskResponse(UUID.randomUUID().toString(), runId, Instant.now(),
                result.answer(), result.plan().steps(), result.results(), result.cancelled());
    }
}
