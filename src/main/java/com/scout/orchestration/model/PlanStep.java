package com.scout.orchestration.model;

import org.springframework.util.Assert;

public record PlanStep(
        String subquery,
        String intent
) {

    public PlanStep {
        Assert.hasText(subquery, "subquery must not be blank");
        Assert.hasText(intent, "intent must not be blank");
    }

    @Override
    public String toString() {
        return "[" + intent + "] " + subquery;
    }
}
