package com.scout.orchestration.api;

import com.scout.orchestration.model.RawPlanStep;

import java.util.List;

/**
 * Decomposes a user question into an ordered list of (subquery, intent) pairs.
 *
 * <p>No quality guarantee is attached to the output: the list may be empty, steps may carry
 * blank subqueries or intents that are not registered. Callers repair the result with
 * {@link com.scout.orchestration.service.PlanValidator} before executing it.
 */
public interface Planner {

    /**
     * @param question               the original user question
     * @param capabilityDescriptions human readable description of every available intent,
     *                               passed to the planner verbatim
     * @return the raw plan, never {@code null}
     */
    List<RawPlanStep> plan(String question, String capabilityDescriptions);
}
