package com.scout.tools;

import static com.scout.orchestration.OrchestrationConstants.TOOL_COMPARE_METRICS;
import static com.scout.orchestration.OrchestrationConstants.TOOL_GET_METRIC;
import static com.scout.orchestration.OrchestrationConstants.TOOL_LIST_AVAILABLE_METRICS;

import com.scout.data.MetricSnapshot;
import com.scout.data.MockDataRepository;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Metric lookup and comparison over the analytics dataset.
 */
public class AnalyzeTools {

    private final MockDataRepository repository;

    public AnalyzeTools(MockDataRepository repository) {
        this.repository = repository;
    }

    @Tool(name = TOOL_GET_METRIC, description = "Get current value and trend for a specific metric.")
    public String getMetric(@ToolParam(description = "Metric name, e.g. mobile_conversions") String metricName) {
        Optional<MetricSnapshot> found = repository.findMetric(metricName);
        if (found.isEmpty()) {
            return "Metric '" + metricName + "' not found. Available: " + String.join(", ", repository.metricNames());
        }
        MetricSnapshot metric = found.get();
        return """
                %s:
                Current: %s
                Previous: %s
                Trend: %s (%s%%)
                Period: %s""".formatted(metricName, metric.current(), metric.previous(), metric.trend(),
                signed(metric.changePct()), metric.period());
    }

    @Tool(name = TOOL_COMPARE_METRICS, description = "Compare two metrics side by side.")
    public String compareMetrics(@ToolParam(description = "First metric name") String metricA,
                                 @ToolParam(description = "Second metric name") String metricB) {
        Optional<MetricSnapshot> a = repository.findMetric(metricA);
        Optional<MetricSnapshot> b = repository.findMetric(metricB);
        if (a.isEmpty() || b.isEmpty()) {
            return "One or both metrics not found: " + metricA + ", " + metricB;
        }
        return "Comparison:\n" + summary(metricA, a.get()) + "\n" + summary(metricB, b.get());
    }

    @Tool(name = TOOL_LIST_AVAILABLE_METRICS, description = "List all available metrics.")
    public String listAvailableMetrics() {
        List<String> lines = new ArrayList<>();
        repository.dataset().metrics().forEach((name, metric) -> lines.add("• " + summary(name, metric)));
        return "Available metrics:\n" + String.join("\n", lines);
    }

    private static String summary(String name, MetricSnapshot metric) {
        return name + ": " + metric.current() + " (" + metric.trend() + " " + signed(metric.changePct()) + "%)";
    }

    private static String signed(double value) {
        return String.format(Locale.ROOT, "%+.1f", value);
    }
}
