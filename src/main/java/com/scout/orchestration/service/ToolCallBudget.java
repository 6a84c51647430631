package com.scout.orchestration.service;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Counts tool calls made while answering one subquery.
 */
final class ToolCallBudget {

    private final int maxCalls;
    private final AtomicInteger used = new AtomicInteger();

    ToolCallBudget(int maxCalls) {
        this.maxCalls = maxCalls;
    }

    /**
     * Claims one call. Returns {@code false} once the budget is spent.
     */
    boolean tryAcquire() {
        return used.incrementAndGet() <= maxCalls;
    }

    int maxCalls() {
        return maxCalls;
    }

    int used() {
        return Math.min(used.get(), maxCalls);
    }
}
