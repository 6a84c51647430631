package com.scout.orchestration.model;

public record StepResult(
        int stepIndex,
        PlanStep step,
        String answer,
        StepStatus status
) {

    public static StepResult completed(int stepIndex, PlanStep step, String answer) {
        return new StepResult(stepIndex, step, answer, StepStatus.COMPLETED);
    }

    public static StepResult failed(int stepIndex, PlanStep step, String answer) {
        return new StepResult(stepIndex, step, answer, StepStatus.FAILED);
    }

    public String intent() {
        return step.intent();
    }
}
