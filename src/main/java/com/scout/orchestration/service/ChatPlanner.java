package com.scout.orchestration.service;

import static com.scout.orchestration.OrchestrationConstants.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.scout.orchestration.api.Planner;
import com.scout.orchestration.model.RawPlanStep;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.lang.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link Planner} backed by a chat model. Asks for a JSON plan, retries once when the reply is not
 * valid JSON and returns an empty plan when the retry fails as well.
 */
@Slf4j
public class ChatPlanner implements Planner {

    private final ChatClient chatClient;
    private final JsonProcessingService jsonProcessingService;
    private final OrchestrationMetricsService metricsService;

    public ChatPlanner(ChatClient chatClient, JsonProcessingService jsonProcessingService,
                       OrchestrationMetricsService metricsService) {
        this.chatClient = chatClient;
        this.jsonProcessingService = jsonProcessingService;
        this.metricsService = metricsService;
    }

    @Override
    public List<RawPlanStep> plan(String question, String capabilityDescriptions) {
        metricsService.recordLlmRequest(PURPOSE_PLAN, null);
        String response = request(PLANNER_SYSTEM_PROMPT, question, capabilityDescriptions);
        JsonNode tree = jsonProcessingService.parseJsonTree(PURPOSE_PLAN, response);
        if (tree == null) {
            metricsService.recordLlmRequest(PURPOSE_PLAN_RETRY, null);
            String retryResponse = request(PLANNER_SYSTEM_PROMPT + INVALID_JSON_RETRY_PROMPT, question, capabilityDescriptions);
            tree = jsonProcessingService.parseJsonTree(PURPOSE_PLAN_RETRY, retryResponse);
        }
        List<RawPlanStep> steps = toRawSteps(tree);
        metricsService.recordPlanResponse(PURPOSE_PLAN, steps);
        return steps;
    }

    private String request(String systemPrompt, String question, String capabilityDescriptions) {
        return chatClient.prompt()
                .system(systemPrompt)
                .user(user -> user.text(PLANNER_USER_TEMPLATE)
                        .param("question", question)
                        .param("intents", capabilityDescriptions)
                        .param("format", PLAN_JSON_FORMAT))
                .call()
                .content();
    }

    /**
     * Accepts {@code {"plan": [...]}}, {@code {"steps": [...]}} or a bare array. Elements that are
     * not objects are skipped; missing fields stay {@code null} for the validator to repair.
     */
    static List<RawPlanStep> toRawSteps(@Nullable JsonNode tree) {
        if (tree == null) {
            return List.of();
        }
        JsonNode array = tree;
        if (tree.isObject()) {
            array = tree.has("plan") ? tree.get("plan") : tree.get("steps");
        }
        if (array == null || !array.isArray()) {
            return List.of();
        }
        List<RawPlanStep> steps = new ArrayList<>();
        for (JsonNode element : array) {
            if (!element.isObject()) {
                continue;
            }
            steps.add(new RawPlanStep(textOrNull(element, "subquery"), textOrNull(element, "intent")));
        }
        return steps;
    }

    private static @Nullable String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
