package com.scout.orchestration.event;

import com.scout.orchestration.model.StepStatus;

import java.time.Duration;

public record StepCompletedEvent(
        int stepIndex,
        String intent,
        StepStatus status,
        Duration elapsed
) {
}
