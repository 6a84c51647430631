package com.scout.orchestration.model;

public enum StepStatus {
    COMPLETED,
    FAILED
}
