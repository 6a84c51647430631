package com.scout.orchestration.event;

import org.springframework.lang.Nullable;

/**
 * Published whenever plan validation substitutes a value the planner produced.
 *
 * @param kind        what was repaired
 * @param stepIndex   position of the repaired step in the raw plan, {@code -1} for an empty plan
 * @param original    the value that was rejected, may be {@code null}
 * @param replacement the value used instead
 */
public record PlanRepairedEvent(
        Kind kind,
        int stepIndex,
        @Nullable String original,
        String replacement
) {

    public enum Kind {
        UNKNOWN_INTENT,
        BLANK_SUBQUERY,
        EMPTY_PLAN
    }
}
