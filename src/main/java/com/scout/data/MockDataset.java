package com.scout.data;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Static lookup data keyed by ticket id, document key and metric name. Key order is preserved.
 */
public record MockDataset(
        Map<String, JiraTicket> tickets,
        Map<String, ConfluenceDoc> docs,
        Map<String, MetricSnapshot> metrics
) {

    public MockDataset {
        tickets = immutableCopy(tickets);
        docs = immutableCopy(docs);
        metrics = immutableCopy(metrics);
    }

    private static <V> Map<String, V> immutableCopy(Map<String, V> source) {
        return source == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
