package com.scout.data;

/**
 * One analytics metric with its current and previous value.
 *
 * @param trend     "up", "down" or "flat"
 * @param changePct signed percentage change from {@code previous} to {@code current}
 */
public record MetricSnapshot(
        double current,
        double previous,
        String trend,
        double changePct,
        String period
) {
}
