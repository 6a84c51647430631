package com.scout.orchestration.service;

import static com.scout.orchestration.OrchestrationConstants.TOOL_BUDGET_EXHAUSTED_MESSAGE;

import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.model.ToolContext;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.definition.ToolDefinition;
import org.springframework.ai.tool.metadata.ToolMetadata;
import org.springframework.lang.Nullable;

import java.util.function.Supplier;

/**
 * Wraps a tool so that calls beyond the shared budget are answered with an instruction to stop
 * calling tools instead of reaching the delegate. Keeps the model's tool loop bounded while still
 * letting it produce an answer.
 */
@Slf4j
final class BudgetedToolCallback implements ToolCallback {

    private final ToolCallback delegate;
    private final ToolCallBudget budget;
    private final String intent;

    BudgetedToolCallback(ToolCallback delegate, ToolCallBudget budget, String intent) {
        this.delegate = delegate;
        this.budget = budget;
        this.intent = intent;
    }

    @Override
    public ToolDefinition getToolDefinition() {
        return delegate.getToolDefinition();
    }

    @Override
    public ToolMetadata getToolMetadata() {
        return delegate.getToolMetadata();
    }

    @Override
    public String call(String input) {
        return execute(input, () -> delegate.call(input));
    }

    @Override
    public String call(String input, @Nullable ToolContext toolContext) {
        return execute(input, () -> delegate.call(input, toolContext));
    }

    private String execute(String input, Supplier<String> call) {
        String toolName = getToolDefinition().name();
        if (!budget.tryAcquire()) {
            log.warn("Tool call budget exhausted for intent={} (max={}), refusing {}.", intent, budget.maxCalls(), toolName);
            return TOOL_BUDGET_EXHAUSTED_MESSAGE.formatted(budget.maxCalls());
        }
        String output = call.get();
        log.debug("Tool call {}/{} for intent={}: {}({}).", budget.used(), budget.maxCalls(), intent, toolName, input);
        return output;
    }
}
