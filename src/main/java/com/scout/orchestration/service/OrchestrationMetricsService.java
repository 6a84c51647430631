package com.scout.orchestration.service;

import com.scout.orchestration.event.PlanRepairedEvent;
import com.scout.orchestration.event.StepCompletedEvent;
import com.scout.orchestration.model.RawPlanStep;
import com.scout.orchestration.model.StepStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

@Service
@Slf4j
public class OrchestrationMetricsService {

    private final AtomicLong llmRequestCount = new AtomicLong();
    private final AtomicLong planResponseCount = new AtomicLong();
    private final AtomicLong stepReceivedCount = new AtomicLong();
    private final AtomicLong stepExecutedCount = new AtomicLong();
    private final AtomicLong stepFailedCount = new AtomicLong();
    private final AtomicLong planRepairCount = new AtomicLong();

    public void recordLlmRequest(String purpose, @Nullable String intent) {
        long count = llmRequestCount.incrementAndGet();
        if (StringUtils.hasText(intent)) {
            log.info("LLM request #{} sent (purpose={}, intent={}).", count, purpose, intent);
        } else {
            log.info("LLM request #{} sent (purpose={}).", count, purpose);
        }
    }

    public void recordPlanResponse(String label, @Nullable List<RawPlanStep> steps) {
        long planCount = planResponseCount.incrementAndGet();
        if (steps == null || steps.isEmpty()) {
            log.info("Plan response #{} ({}) returned no steps. Total plans={}.", planCount, label, planCount);
            return;
        }
        long totalSteps = stepReceivedCount.addAndGet(steps.size());
        log.info("Plan response #{} ({}) received {} steps. Total plans={}, total steps received={}.",
                planCount, label, steps.size(), planCount, totalSteps);
    }

    @EventListener
    public void onPlanRepaired(PlanRepairedEvent event) {
        long repairs = planRepairCount.incrementAndGet();
        log.debug("Plan repair #{}: {} at step {} ('{}' -> '{}').",
                repairs, event.kind(), event.stepIndex(), event.original(), event.replacement());
    }

    @EventListener
    public void onStepCompleted(StepCompletedEvent event) {
        stepExecutedCount.incrementAndGet();
        if (event.status() == StepStatus.FAILED) {
            stepFailedCount.incrementAndGet();
        }
        log.info("Step {} ({}) finished with status {} in {} ms.",
                event.stepIndex(), event.intent(), event.status(), event.elapsed().toMillis());
    }

    public long planRepairs() {
        return planRepairCount.get();
    }

    public long stepsExecuted() {
        return stepExecutedCount.get();
    }

    public long stepsFailed() {
        return stepFailedCount.get();
    }

    public void logSummary() {
        log.info("Orchestration stats: totalRequests={}, totalPlans={}, totalStepsReceived={}, totalStepsExecuted={}, "
                        + "totalStepsFailed={}, totalPlanRepairs={}.",
                llmRequestCount.get(), planResponseCount.get(), stepReceivedCount.get(), stepExecutedCount.get(),
                stepFailedCount.get(), planRepairCount.get());
    }
}
