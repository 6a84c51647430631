package com.scout.orchestration.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.lang.Nullable;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A ToolCallbackProvider wrapper that filters the delegate provider's callbacks by allowed tool names.
 * Name matching is case-insensitive. If the allowed set is empty, provides no tools.
 */
public class FilteringToolCallbackProvider implements ToolCallbackProvider {

    private static final Logger log = LoggerFactory.getLogger(FilteringToolCallbackProvider.class);
    private final ToolCallbackProvider delegate;
    private final Set<String> allowedNames;

    public FilteringToolCallbackProvider(ToolCallbackProvider delegate, @Nullable List<String> allowedNames) {
        this.delegate = delegate;
        this.allowedNames = allowedNames == null ? Set.of() : allowedNames.stream()
                .filter(s -> s != null && !s.isBlank())
                .map(s -> s.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
    }

    @Override
    public ToolCallback[] getToolCallbacks() {
        if (delegate == null || allowedNames.isEmpty()) {
            return new ToolCallback[0];
        }
        ToolCallback[] callbacks = delegate.getToolCallbacks();
        if (callbacks == null || callbacks.length == 0) {
            return new ToolCallback[0];
        }
        ToolCallback[] filtered = Arrays.stream(callbacks)
                .filter(this::isAllowed)
                .toArray(ToolCallback[]::new);
        if (filtered.length < allowedNames.size()) {
            log.warn("Some allowed tools are not available. allowed={}, available={}",
                    allowedNames, describeCallbacks(callbacks));
        }
        return filtered;
    }

    private boolean isAllowed(ToolCallback callback) {
        return allowedNames.contains(nameOf(callback));
    }

    private static String nameOf(@Nullable ToolCallback callback) {
        if (callback == null || callback.getToolDefinition() == null || callback.getToolDefinition().name() == null) {
            return "";
        }
        return callback.getToolDefinition().name().trim().toLowerCase(Locale.ROOT);
    }

    private static List<String> describeCallbacks(ToolCallback[] callbacks) {
        return Arrays.stream(callbacks)
                .map(FilteringToolCallbackProvider::nameOf)
                .filter(name -> !name.isBlank())
                .toList();
    }
}
