package com.scout.demo;

import com.scout.config.ScoutProperties;
import com.scout.orchestration.OrchestratorService;
import com.scout.orchestration.model.OrchestrationResult;
import com.scout.orchestration.service.JsonProcessingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Runs a batch of sample questions at startup and logs plan and answer of each.
 * Enabled with {@code scout.demo.enabled=true}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "scout.demo", name = "enabled", havingValue = "true")
public class ScoutDemoRunner implements CommandLineRunner {

    static final List<String> DEFAULT_QUESTIONS = List.of(
            "What tickets mention Safari?",
            "Get details for ticket SHOP-2847",
            "How are mobile conversions trending?",
            "Find P0 tickets and get details for the most critical one",
            "Are there checkout issues and are conversion rates down?",
            "Get details for SHOP-3001 and check if mobile metrics are affected",
            "Find Safari-related tickets, get details for SHOP-2847, and check Safari user metrics");

    private final OrchestratorService orchestratorService;
    private final JsonProcessingService jsonProcessingService;
    private final ScoutProperties properties;

    @Override
    public void run(String... args) {
        List<String> questions = properties.getDemo().getQuestions().isEmpty()
                ? DEFAULT_QUESTIONS
                : properties.getDemo().getQuestions();
        for (int i = 0; i < questions.size(); i++) {
            String question = questions.get(i);
            log.info("Query {}: {}", i + 1, question);
            OrchestrationResult result = orchestratorService.run(question);
            log.info("Execution plan:\n{}", jsonProcessingService.toJson(result.plan().steps()));
            log.info("Answer:\n{}", result.answer());
        }
        log.info("All {} demo queries complete.", questions.size());
    }
}
