package com.scout.orchestration.service;

import static com.scout.orchestration.OrchestrationConstants.TOOL_BUDGET_EXHAUSTED_MESSAGE;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.ToolCallbackProvider;

import java.util.List;

class BudgetedToolCallbackTest {

    @Test
    void testCallsBeyondBudgetDoNotReachDelegate() {
        StubToolCallback delegate = new StubToolCallback("get_metric");
        BudgetedToolCallback callback = new BudgetedToolCallback(delegate, new ToolCallBudget(2), "analyze");

        assertEquals("get_metric result", callback.call("{}"));
        assertEquals("get_metric result", callback.call("{}", null));
        assertEquals(TOOL_BUDGET_EXHAUSTED_MESSAGE.formatted(2), callback.call("{}"));
        assertEquals(2, delegate.calls());
        assertEquals("get_metric", callback.getToolDefinition().name());
    }

    @Test
    void testBudgetIsSharedAcrossToolsOfOneAnswer() {
        StubToolCallback jira = new StubToolCallback("search_jira");
        StubToolCallback confluence = new StubToolCallback("search_confluence");
        ToolCallBudget budget = new ToolCallBudget(3);
        BudgetedToolCallback first = new BudgetedToolCallback(jira, budget, "search");
        BudgetedToolCallback second = new BudgetedToolCallback(confluence, budget, "search");

        first.call("{}");
        second.call("{}");
        first.call("{}");
        String refused = second.call("{}");

        assertEquals(TOOL_BUDGET_EXHAUSTED_MESSAGE.formatted(3), refused);
        assertEquals(2, jira.calls());
        assertEquals(1, confluence.calls());
        assertEquals(3, budget.used());
    }

    @Test
    void testEachAnswerGetsFreshBudget() {
        StubToolCallback delegate = new StubToolCallback("get_ticket_details");
        ToolCallbackProvider provider = () -> new ToolCallback[] {delegate};
        ChatCapabilityHandler handler = new ChatCapabilityHandler("retrieve", "fetch", "prompt",
                mock(ChatClient.class), provider, 1, new OrchestrationContextService(),
                new OrchestrationMetricsService());

        List<ToolCallback> firstAnswer = handler.budgetedCallbacks();
        firstAnswer.get(0).call("{}");
        assertEquals(TOOL_BUDGET_EXHAUSTED_MESSAGE.formatted(1), firstAnswer.get(0).call("{}"));

        List<ToolCallback> secondAnswer = handler.budgetedCallbacks();
        assertEquals("get_ticket_details result", secondAnswer.get(0).call("{}"));
        assertEquals(2, delegate.calls());
    }
}
