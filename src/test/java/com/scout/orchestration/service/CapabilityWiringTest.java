package com.scout.orchestration.service;

import static com.scout.orchestration.OrchestrationConstants.*;
import static org.junit.jupiter.api.Assertions.*;

import com.scout.ScoutApplication;
import com.scout.orchestration.api.CapabilityHandler;
import com.scout.orchestration.registry.CapabilityRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.stream.Collectors;

@SpringBootTest(classes = ScoutApplication.class, properties = {
        "spring.ai.model.chat=none",
        "spring.ai.model.embedding=none",
        "spring.ai.model.image=none",
        "spring.ai.model.audio.speech=none",
        "spring.ai.model.audio.transcription=none",
        "spring.ai.model.moderation=none"
})
class CapabilityWiringTest {

    @MockitoBean
    private ChatModel chatModel;

    @Autowired
    private CapabilityRegistry registry;

    @Autowired
    @Qualifier("handlerExecutor")
    private ExecutorService handlerExecutor;

    @Test
    void testRegistryHoldsHandlersInDeclaredOrder() {
        assertEquals(List.of(INTENT_SEARCH, INTENT_RETRIEVE, INTENT_ANALYZE), registry.intents());
        assertEquals(INTENT_SEARCH, registry.defaultIntent());
        assertEquals(SEARCH_DESCRIPTION, registry.descriptions().get(INTENT_SEARCH));
    }

    @Test
    void testEachHandlerOnlySeesItsOwnTools() {
        assertEquals(Set.copyOf(SEARCH_TOOLS), toolNames(INTENT_SEARCH));
        assertEquals(Set.copyOf(RETRIEVE_TOOLS), toolNames(INTENT_RETRIEVE));
        assertEquals(Set.copyOf(ANALYZE_TOOLS), toolNames(INTENT_ANALYZE));
    }

    @Test
    void testHandlerExecutorGrowsBeyondCoreThreads() {
        ThreadPoolExecutor pool = assertInstanceOf(ThreadPoolExecutor.class, handlerExecutor);
        assertEquals(4, pool.getCorePoolSize());
        assertEquals(16, pool.getMaximumPoolSize());
    }

    private Set<String> toolNames(String intent) {
        CapabilityHandler handler = registry.resolve(intent);
        ChatCapabilityHandler chatHandler = assertInstanceOf(ChatCapabilityHandler.class, handler);
        return chatHandler.budgetedCallbacks().stream()
                .map(callback -> callback.getToolDefinition().name())
                .collect(Collectors.toSet());
    }
}
