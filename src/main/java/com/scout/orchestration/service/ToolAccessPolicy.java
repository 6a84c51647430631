package com.scout.orchestration.service;

import static com.scout.orchestration.OrchestrationConstants.*;

import com.scout.config.ScoutProperties;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Decides which tools each capability may call and how many calls one answer may spend.
 * Uses configuration (scout.capabilities.&lt;intent&gt;) with per-intent defaults.
 */
@Service
public class ToolAccessPolicy {

    private final ScoutProperties properties;

    public ToolAccessPolicy(ScoutProperties properties) {
        this.properties = properties;
    }

    public List<String> allowedToolNames(String intent) {
        List<String> configured = normalize(properties.getCapabilityConfig(intent).getTools());
        if (!configured.isEmpty()) {
            return configured;
        }
        return switch (normalizeIntent(intent)) {
            case INTENT_SEARCH -> SEARCH_TOOLS;
            case INTENT_RETRIEVE -> RETRIEVE_TOOLS;
            case INTENT_ANALYZE -> ANALYZE_TOOLS;
            default -> List.of();
        };
    }

    public int maxToolCalls(String intent) {
        int configured = properties.getCapabilityConfig(intent).getMaxToolCalls();
        if (configured > 0) {
            return configured;
        }
        return switch (normalizeIntent(intent)) {
            case INTENT_RETRIEVE -> RETRIEVE_MAX_TOOL_CALLS;
            case INTENT_ANALYZE -> ANALYZE_MAX_TOOL_CALLS;
            default -> SEARCH_MAX_TOOL_CALLS;
        };
    }

    private static String normalizeIntent(String intent) {
        return intent == null ? "" : intent.trim().toLowerCase(Locale.ROOT);
    }

    private static List<String> normalize(List<String> in) {
        if (in == null) {
            return List.of();
        }
        return in.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(s -> s.toLowerCase(Locale.ROOT))
                .distinct()
                .toList();
    }
}
