package com.scout.orchestration.api;

/**
 * Answers one subquery for a single intent (search, retrieve, analyze, ...).
 *
 * <p>Implementations must not mutate orchestration state. A lookup that finds nothing is
 * reported as a descriptive answer, not as an exception; only infrastructure failures
 * (unreachable model or data source) are thrown.
 */
public interface CapabilityHandler {

    /**
     * Intent name this handler is registered under. Lower case.
     */
    String intent();

    /**
     * One line purpose statement with example phrasings, shown to the planner.
     */
    String description();

    /**
     * @param subquery the step's subquery
     * @param context  rendered answers of all previous steps, empty for the first step
     * @return the answer text
     */
    String answer(String subquery, String context);
}
