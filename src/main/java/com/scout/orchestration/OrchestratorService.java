package com.scout.orchestration;

import static com.scout.orchestration.OrchestrationConstants.*;

import com.scout.config.ScoutProperties;
import com.scout.orchestration.api.CapabilityHandler;
import com.scout.orchestration.api.Planner;
import com.scout.orchestration.event.StepCompletedEvent;
import com.scout.orchestration.model.ExecutionPlan;
import com.scout.orchestration.model.OrchestrationResult;
import com.scout.orchestration.model.PlanStep;
import com.scout.orchestration.model.RawPlanStep;
import com.scout.orchestration.model.StepResult;
import com.scout.orchestration.registry.CapabilityRegistry;
import com.scout.orchestration.service.AnswerSynthesizer;
import com.scout.orchestration.service.OrchestrationContextService;
import com.scout.orchestration.service.OrchestrationMetricsService;
import com.scout.orchestration.service.PlanValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Plans a question, executes the validated plan step by step and synthesizes the final answer.
 *
 * <p>Steps run strictly in plan order: each handler sees the rendered answers of every earlier
 * step. A failing or timed-out handler produces a degraded step result and execution continues.
 * Only a registry miss on a validated intent escapes as an exception.
 *
 * <p>The service holds no per-call state, so concurrent calls are independent.
 */
@Service
@Slf4j
public class OrchestratorService {

    private final Planner planner;
    private final CapabilityRegistry registry;
    private final PlanValidator planValidator;
    private final AnswerSynthesizer synthesizer;
    private final OrchestrationContextService contextService;
    private final OrchestrationMetricsService metricsService;
    private final ApplicationEventPublisher eventPublisher;
    private final ExecutorService handlerExecutor;
    private final ExecutorService plannerExecutor;
    private final ScoutProperties properties;
    private final String capabilityDescriptions;

    public OrchestratorService(
            Planner planner,
            CapabilityRegistry registry,
            PlanValidator planValidator,
            AnswerSynthesizer synthesizer,
            OrchestrationContextService contextService,
            OrchestrationMetricsService metricsService,
            ApplicationEventPublisher eventPublisher,
            @Qualifier("handlerExecutor") ExecutorService handlerExecutor,
            @Qualifier("plannerExecutor") ExecutorService plannerExecutor,
            ScoutProperties properties) {
        this.planner = planner;
        this.registry = registry;
        this.planValidator = planValidator;
        this.synthesizer = synthesizer;
        this.contextService = contextService;
        this.metricsService = metricsService;
        this.eventPublisher = eventPublisher;
        this.handlerExecutor = handlerExecutor;
        this.plannerExecutor = plannerExecutor;
        this.properties = properties;
        this.capabilityDescriptions = registry.describeCapabilities() + "\n\n" + PLANNING_EXAMPLES.trim();
    }

    public OrchestrationResult run(String question) {
        return run(question, CancellationSignal.none());
    }

    public OrchestrationResult run(String question, CancellationSignal cancellation) {
        if (!StringUtils.hasText(question)) {
            throw new IllegalArgumentException("Question must not be blank");
        }
        List<RawPlanStep> rawPlan = requestPlan(question);
        ExecutionPlan plan = planValidator.validate(rawPlan, registry, registry.defaultIntent(), question);
        log.info("Execution plan with {} step(s): {}", plan.size(), plan.steps());

        List<StepResult> results = new ArrayList<>(plan.size());
        String context = "";
        boolean cancelled = false;
        for (int index = 0; index < plan.size(); index++) {
            if (cancellation.isCancelled() || Thread.currentThread().isInterrupted()) {
                log.info("Orchestration cancelled after {} of {} step(s).", results.size(), plan.size());
                cancelled = true;
                break;
            }
            PlanStep step = plan.step(index);
            CapabilityHandler handler = registry.resolve(step.intent());
            StepResult result = executeStep(index, step, handler, context);
            results.add(result);
            context = contextService.append(context, result);
        }

        String answer = results.isEmpty() ? CANCELLED_BEFORE_ANY_STEP : synthesizer.synthesize(results);
        metricsService.logSummary();
        return new OrchestrationResult(answer, plan, results, cancelled);
    }

    private List<RawPlanStep> requestPlan(String question) {
        Duration timeout = properties.getPlannerTimeout();
        try {
            List<RawPlanStep> rawPlan = callWithTimeout(plannerExecutor,
                    () -> planner.plan(question, capabilityDescriptions), timeout);
            return rawPlan != null ? rawPlan : List.of();
        } catch (TimeoutException ex) {
            log.warn("Planner timed out after {} ms, using fallback plan.", timeout.toMillis());
        } catch (ExecutionException ex) {
            log.warn("Planner failed, using fallback plan: {}", describeCause(ex));
        } catch (RejectedExecutionException ex) {
            log.warn("Planner could not be scheduled, using fallback plan: {}", ex.getMessage());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for the planner.");
        }
        return List.of();
    }

    private StepResult executeStep(int index, PlanStep step, CapabilityHandler handler, String context) {
        long started = System.nanoTime();
        Duration timeout = properties.getHandlerTimeout();
        StepResult result;
        try {
            String answer = callWithTimeout(handlerExecutor, () -> handler.answer(step.subquery(), context), timeout);
            result = StepResult.completed(index, step, answer != null ? answer : "");
        } catch (TimeoutException ex) {
            result = degraded(index, step, "timed out after " + timeout.toMillis() + " ms");
        } catch (ExecutionException ex) {
            result = degraded(index, step, describeCause(ex));
        } catch (RejectedExecutionException ex) {
            result = degraded(index, step, "no handler thread available");
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            result = degraded(index, step, "interrupted");
        }
        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
        eventPublisher.publishEvent(new StepCompletedEvent(index, step.intent(), result.status(), elapsed));
        return result;
    }

    private StepResult degraded(int index, PlanStep step, String reason) {
        log.warn("Step {} ({}) could not be completed: {}", index, step.intent(), reason);
        return StepResult.failed(index, step, STEP_FAILED_MESSAGE.formatted(index, step.intent(), reason));
    }

    /**
     * Runs {@code call} on {@code executor} and waits at most {@code timeout}. On timeout the task is
     * interrupted so its thread goes back to the pool.
     */
    private static <T> T callWithTimeout(ExecutorService executor, Callable<T> call, Duration timeout)
            throws TimeoutException, ExecutionException, InterruptedException {
        Future<T> future = executor.submit(call);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException | InterruptedException ex) {
            future.cancel(true);
            throw ex;
        }
    }

    private static String describeCause(ExecutionException ex) {
        Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
        return StringUtils.hasText(cause.getMessage())
                ? cause.getMessage()
                : cause.getClass().getSimpleName();
    }
}
