package com.scout.config;

import static com.scout.orchestration.OrchestrationConstants.*;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scout.data.MockDataRepository;
import com.scout.orchestration.api.CapabilityHandler;
import com.scout.orchestration.api.Planner;
import com.scout.orchestration.registry.CapabilityRegistry;
import com.scout.orchestration.service.ChatCapabilityHandler;
import com.scout.orchestration.service.ChatPlanner;
import com.scout.orchestration.service.FilteringToolCallbackProvider;
import com.scout.orchestration.service.JsonProcessingService;
import com.scout.orchestration.service.OrchestrationContextService;
import com.scout.orchestration.service.OrchestrationMetricsService;
import com.scout.orchestration.service.ToolAccessPolicy;
import com.scout.tools.AnalyzeTools;
import com.scout.tools.RetrieveTools;
import com.scout.tools.SearchTools;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

@Slf4j
@Configuration
public class ScoutConfig {

    @Bean
    public ChatClient chatClient(ChatModel chatModel) {
        return ChatClient.builder(chatModel).build();
    }

    /**
     * Handler calls run here. Threads above {@code handler-concurrency} are created on demand, so a
     * handler that ignores interruption after its timeout cannot starve later calls; beyond
     * {@code handler-max-pool-size} submissions are rejected and the step degrades.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService handlerExecutor(ScoutProperties properties) {
        return boundedExecutor(properties.getHandlerConcurrency(), properties.getHandlerMaxPoolSize());
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService plannerExecutor() {
        return Executors.newCachedThreadPool();
    }

    static ThreadPoolExecutor boundedExecutor(int corePoolSize, int maxPoolSize) {
        int core = Math.max(1, corePoolSize);
        return new ThreadPoolExecutor(core, Math.max(core, maxPoolSize), 60L, TimeUnit.SECONDS,
                new SynchronousQueue<>());
    }

    @Bean
    public MockDataRepository mockDataRepository(ObjectMapper objectMapper) {
        return MockDataRepository.loadDefault(objectMapper);
    }

    @Bean
    public SearchTools searchTools(MockDataRepository repository) {
        return new SearchTools(repository);
    }

    @Bean
    public RetrieveTools retrieveTools(MockDataRepository repository) {
        return new RetrieveTools(repository);
    }

    @Bean
    public AnalyzeTools analyzeTools(MockDataRepository repository) {
        return new AnalyzeTools(repository);
    }

    @Bean
    public ToolCallbackProvider lookupToolCallbackProvider(SearchTools searchTools, RetrieveTools retrieveTools,
                                                           AnalyzeTools analyzeTools) {
        return MethodToolCallbackProvider.builder()
                .toolObjects(searchTools, retrieveTools, analyzeTools)
                .build();
    }

    @Bean
    public Planner planner(ChatClient chatClient, JsonProcessingService jsonProcessingService,
                           OrchestrationMetricsService metricsService) {
        return new ChatPlanner(chatClient, jsonProcessingService, metricsService);
    }

    @Bean
    @Order(1)
    public CapabilityHandler searchHandler(ChatClient chatClient, ToolCallbackProvider lookupToolCallbackProvider,
                                           ToolAccessPolicy toolAccessPolicy, OrchestrationContextService contextService,
                                           OrchestrationMetricsService metricsService) {
        return capabilityHandler(INTENT_SEARCH, SEARCH_DESCRIPTION, SEARCH_SYSTEM_PROMPT, chatClient,
                lookupToolCallbackProvider, toolAccessPolicy, contextService, metricsService);
    }

    @Bean
    @Order(2)
    public CapabilityHandler retrieveHandler(ChatClient chatClient, ToolCallbackProvider lookupToolCallbackProvider,
                                             ToolAccessPolicy toolAccessPolicy, OrchestrationContextService contextService,
                                             OrchestrationMetricsService metricsService) {
        return capabilityHandler(INTENT_RETRIEVE, RETRIEVE_DESCRIPTION, RETRIEVE_SYSTEM_PROMPT, chatClient,
                lookupToolCallbackProvider, toolAccessPolicy, contextService, metricsService);
    }

    @Bean
    @Order(3)
    public CapabilityHandler analyzeHandler(ChatClient chatClient, ToolCallbackProvider lookupToolCallbackProvider,
                                            ToolAccessPolicy toolAccessPolicy, OrchestrationContextService contextService,
                                            OrchestrationMetricsService metricsService) {
        return capabilityHandler(INTENT_ANALYZE, ANALYZE_DESCRIPTION, ANALYZE_SYSTEM_PROMPT, chatClient,
                lookupToolCallbackProvider, toolAccessPolicy, contextService, metricsService);
    }

    @Bean
    public CapabilityRegistry capabilityRegistry(List<CapabilityHandler> handlers, ScoutProperties properties) {
        CapabilityRegistry.Builder builder = CapabilityRegistry.builder();
        handlers.forEach(builder::register);
        CapabilityRegistry registry = builder.defaultIntent(properties.getDefaultIntent()).build();
        log.info("Capability registry ready: intents={}, default={}.", registry.intents(), registry.defaultIntent());
        return registry;
    }

    private static CapabilityHandler capabilityHandler(String intent, String description, String systemPrompt,
                                                       ChatClient chatClient, ToolCallbackProvider tools,
                                                       ToolAccessPolicy toolAccessPolicy,
                                                       OrchestrationContextService contextService,
                                                       OrchestrationMetricsService metricsService) {
        ToolCallbackProvider allowed = new FilteringToolCallbackProvider(tools, toolAccessPolicy.allowedToolNames(intent));
        return new ChatCapabilityHandler(intent, description, systemPrompt, chatClient, allowed,
                toolAccessPolicy.maxToolCalls(intent), contextService, metricsService);
    }
}
