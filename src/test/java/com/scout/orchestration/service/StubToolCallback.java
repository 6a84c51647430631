package com.scout.orchestration.service;

import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.definition.ToolDefinition;

import java.util.concurrent.atomic.AtomicInteger;

class StubToolCallback implements ToolCallback {

    private final ToolDefinition definition;
    private final AtomicInteger calls = new AtomicInteger();

    StubToolCallback(String name) {
        this.definition = ToolDefinition.builder()
                .name(name)
                .description("stub " + name)
                .inputSchema("{}")
                .build();
    }

    @Override
    public ToolDefinition getToolDefinition() {
        return definition;
    }

    @Override
    public String call(String toolInput) {
        calls.incrementAndGet();
        return definition.name() + " result";
    }

    int calls() {
        return calls.get();
    }
}
