package com.scout.orchestration.service;

import com.scout.orchestration.event.PlanRepairedEvent;
import com.scout.orchestration.model.ExecutionPlan;
import com.scout.orchestration.model.PlanStep;
import com.scout.orchestration.model.RawPlanStep;
import com.scout.orchestration.registry.CapabilityRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns planner output into an executable plan. Never rejects a plan: unknown intents fall back
 * to the default intent, blank subqueries to the original question and an empty plan to a single
 * default step. Every substitution is logged and published as a {@link PlanRepairedEvent}.
 *
 * <p>Precondition: {@code defaultIntent} is registered. {@link CapabilityRegistry} guarantees this
 * for its own default, so {@code validate(raw, registry, registry.defaultIntent(), question)} always
 * succeeds.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PlanValidator {

    private final ApplicationEventPublisher eventPublisher;

    /**
     * @return a non-empty plan whose intents are all registered and whose subqueries are non-blank
     * @throws IllegalArgumentException if {@code defaultIntent} is not registered (caller error)
     */
    public ExecutionPlan validate(@Nullable List<RawPlanStep> rawPlan, CapabilityRegistry registry,
                                  String defaultIntent, String originalQuestion) {
        if (!registry.has(defaultIntent)) {
            throw new IllegalArgumentException("Default intent '" + defaultIntent + "' is not registered");
        }
        String fallbackIntent = CapabilityRegistry.normalize(defaultIntent);
        List<PlanStep> steps = new ArrayList<>();
        if (rawPlan != null) {
            for (int index = 0; index < rawPlan.size(); index++) {
                RawPlanStep raw = rawPlan.get(index);
                if (raw == null) {
                    continue;
                }
                steps.add(new PlanStep(
                        repairSubquery(index, raw.subquery(), originalQuestion),
                        repairIntent(index, raw.intent(), registry, fallbackIntent)));
            }
        }
        if (steps.isEmpty()) {
            log.warn("Empty plan returned, falling back to a single '{}' step.", fallbackIntent);
            eventPublisher.publishEvent(new PlanRepairedEvent(PlanRepairedEvent.Kind.EMPTY_PLAN, -1, null, fallbackIntent));
            steps.add(new PlanStep(originalQuestion, fallbackIntent));
        }
        return new ExecutionPlan(steps);
    }

    private String repairIntent(int index, @Nullable String intent, CapabilityRegistry registry, String fallbackIntent) {
        if (registry.has(intent)) {
            return CapabilityRegistry.normalize(intent);
        }
        log.warn("Unknown intent '{}' at step {}, defaulting to '{}'.", intent, index, fallbackIntent);
        eventPublisher.publishEvent(new PlanRepairedEvent(PlanRepairedEvent.Kind.UNKNOWN_INTENT, index, intent, fallbackIntent));
        return fallbackIntent;
    }

    private String repairSubquery(int index, @Nullable String subquery, String originalQuestion) {
        if (StringUtils.hasText(subquery)) {
            return subquery;
        }
        log.warn("Blank subquery at step {}, using the original question.", index);
        eventPublisher.publishEvent(new PlanRepairedEvent(PlanRepairedEvent.Kind.BLANK_SUBQUERY, index, subquery, originalQuestion));
        return originalQuestion;
    }
}
