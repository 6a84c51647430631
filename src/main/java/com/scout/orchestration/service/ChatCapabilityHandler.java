package com.scout.orchestration.service;

import static com.scout.orchestration.OrchestrationConstants.CAPABILITY_USER_TEMPLATE;
import static com.scout.orchestration.OrchestrationConstants.PURPOSE_CAPABILITY;

import com.scout.orchestration.api.CapabilityHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link CapabilityHandler} that lets a chat model answer with a fixed set of lookup tools.
 * One instance per intent; the intent decides the system prompt, the tools and the tool call budget.
 */
@Slf4j
public class ChatCapabilityHandler implements CapabilityHandler {

    private final String intent;
    private final String description;
    private final String systemPrompt;
    private final ChatClient chatClient;
    private final ToolCallbackProvider toolCallbackProvider;
    private final int maxToolCalls;
    private final OrchestrationContextService contextService;
    private final OrchestrationMetricsService metricsService;

    public ChatCapabilityHandler(String intent, String description, String systemPrompt, ChatClient chatClient,
                                 ToolCallbackProvider toolCallbackProvider, int maxToolCalls,
                                 OrchestrationContextService contextService,
                                 OrchestrationMetricsService metricsService) {
        this.intent = intent;
        this.description = description;
        this.systemPrompt = systemPrompt;
        this.chatClient = chatClient;
        this.toolCallbackProvider = toolCallbackProvider;
        this.maxToolCalls = maxToolCalls;
        this.contextService = contextService;
        this.metricsService = metricsService;
    }

    @Override
    public String intent() {
        return intent;
    }

    @Override
    public String description() {
        return description;
    }

    @Override
    public String answer(String subquery, String context) {
        metricsService.recordLlmRequest(PURPOSE_CAPABILITY, intent);
        String normalizedContext = contextService.defaultContext(context);
        String answer = chatClient.prompt()
                .system(systemPrompt)
                .user(user -> user.text(CAPABILITY_USER_TEMPLATE)
                        .param("question", subquery)
                        .param("context", normalizedContext))
                .toolCallbacks(budgetedCallbacks())
                .call()
                .content();
        if (!StringUtils.hasText(answer)) {
            log.warn("Empty answer from {} capability for subquery: {}", intent, subquery);
            return "No " + intent + " answer could be produced for: " + subquery;
        }
        return answer;
    }

    List<ToolCallback> budgetedCallbacks() {
        ToolCallBudget budget = new ToolCallBudget(maxToolCalls);
        List<ToolCallback> callbacks = new ArrayList<>();
        for (ToolCallback callback : toolCallbackProvider.getToolCallbacks()) {
            callbacks.add(new BudgetedToolCallback(callback, budget, intent));
        }
        return callbacks;
    }
}
