package com.scout.data;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;
import org.springframework.lang.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only access to the Jira, Confluence and analytics mock data. The dataset is loaded once
 * from a JSON resource; failing to read it is an infrastructure error and aborts construction.
 */
@Slf4j
public class MockDataRepository {

    public static final String DEFAULT_LOCATION = "data/scout-mock-data.json";

    private final MockDataset dataset;

    public MockDataRepository(MockDataset dataset) {
        this.dataset = dataset;
    }

    public static MockDataRepository load(ObjectMapper objectMapper, Resource resource) {
        try (InputStream in = resource.getInputStream()) {
            MockDataset dataset = objectMapper.readValue(in, MockDataset.class);
            log.info("Loaded mock data from {}: {} tickets, {} docs, {} metrics.", resource.getDescription(),
                    dataset.tickets().size(), dataset.docs().size(), dataset.metrics().size());
            return new MockDataRepository(dataset);
        } catch (IOException ex) {
            throw new IllegalStateException("Unable to load mock data from " + resource.getDescription(), ex);
        }
    }

    public static MockDataRepository loadDefault(ObjectMapper objectMapper) {
        return load(objectMapper, new ClassPathResource(DEFAULT_LOCATION));
    }

    public MockDataset dataset() {
        return dataset;
    }

    public Optional<JiraTicket> findTicket(@Nullable String ticketId) {
        if (ticketId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(dataset.tickets().get(ticketId.trim().toUpperCase(Locale.ROOT)));
    }

    public Optional<ConfluenceDoc> findDoc(@Nullable String docKey) {
        if (docKey == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(dataset.docs().get(docKey.trim()));
    }

    public Optional<MetricSnapshot> findMetric(@Nullable String metricName) {
        if (metricName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(dataset.metrics().get(metricName.trim()));
    }

    public Set<String> docKeys() {
        return dataset.docs().keySet();
    }

    public Set<String> metricNames() {
        return dataset.metrics().keySet();
    }
}
