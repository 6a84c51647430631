package com.scout.orchestration.registry;

import com.scout.orchestration.api.CapabilityHandler;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Immutable mapping from intent name to {@link CapabilityHandler}.
 *
 * <p>Built once at startup and shared read-only by all orchestration calls. Intent names are
 * trimmed and lower-cased on registration and lookup. The registry always holds at least one
 * handler and a default intent that is itself registered.
 */
public final class CapabilityRegistry {

    private final Map<String, CapabilityHandler> handlers;
    private final String defaultIntent;

    private CapabilityRegistry(Map<String, CapabilityHandler> handlers, String defaultIntent) {
        this.handlers = Collections.unmodifiableMap(new LinkedHashMap<>(handlers));
        this.defaultIntent = defaultIntent;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static String normalize(@Nullable String intent) {
        return StringUtils.hasText(intent) ? intent.trim().toLowerCase(Locale.ROOT) : "";
    }

    public boolean has(@Nullable String intent) {
        return handlers.containsKey(normalize(intent));
    }

    public CapabilityHandler resolve(@Nullable String intent) {
        CapabilityHandler handler = handlers.get(normalize(intent));
        if (handler == null) {
            throw new CapabilityNotFoundException(intent);
        }
        return handler;
    }

    public String defaultIntent() {
        return defaultIntent;
    }

    /**
     * Registered intents in registration order.
     */
    public List<String> intents() {
        return List.copyOf(handlers.keySet());
    }

    /**
     * Intent name to description, in registration order.
     */
    public Map<String, String> descriptions() {
        Map<String, String> descriptions = new LinkedHashMap<>();
        handlers.forEach((intent, handler) -> descriptions.put(intent, handler.description()));
        return Collections.unmodifiableMap(descriptions);
    }

    /**
     * Renders the "Available intents" block handed to the planner.
     */
    public String describeCapabilities() {
        StringBuilder sb = new StringBuilder("Available intents:\n");
        handlers.forEach((intent, handler) -> {
            sb.append("- ").append(intent);
            if (StringUtils.hasText(handler.description())) {
                sb.append(": ").append(handler.description().trim());
            }
            sb.append("\n");
        });
        return sb.toString().trim();
    }

    public static final class Builder {

        private final Map<String, CapabilityHandler> handlers = new LinkedHashMap<>();
        private String defaultIntent;

        private Builder() {
        }

        public Builder register(String intent, CapabilityHandler handler) {
            String key = normalize(intent);
            if (key.isEmpty()) {
                throw new IllegalArgumentException("Intent name must not be blank");
            }
            if (handler == null) {
                throw new IllegalArgumentException("Handler for intent '" + key + "' must not be null");
            }
            if (handlers.putIfAbsent(key, handler) != null) {
                throw new IllegalStateException("Intent '" + key + "' is already registered");
            }
            return this;
        }

        public Builder register(CapabilityHandler handler) {
            return register(handler.intent(), handler);
        }

        public Builder defaultIntent(String intent) {
            this.defaultIntent = normalize(intent);
            return this;
        }

        public CapabilityRegistry build() {
            if (handlers.isEmpty()) {
                throw new IllegalStateException("Capability registry requires at least one handler");
            }
            String fallback = StringUtils.hasText(defaultIntent) ? defaultIntent : handlers.keySet().iterator().next();
            if (!handlers.containsKey(fallback)) {
                throw new IllegalStateException("Default intent '" + fallback + "' is not registered. Registered: "
                        + String.join(", ", handlers.keySet()));
            }
            return new CapabilityRegistry(handlers, fallback);
        }
    }
}
