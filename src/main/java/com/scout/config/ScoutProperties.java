package com.scout.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "scout")
public class ScoutProperties {

    private String defaultIntent = "search";
    private Duration plannerTimeout = Duration.ofSeconds(60);
    private Duration handlerTimeout = Duration.ofSeconds(90);
    private int handlerConcurrency = 4;
    private int handlerMaxPoolSize = 16;
    private Map<String, CapabilityConfig> capabilities = new HashMap<>();
    private DemoConfig demo = new DemoConfig();

    public static class CapabilityConfig {
        private int maxToolCalls;
        private List<String> tools = new ArrayList<>();

        public CapabilityConfig() {}

        public CapabilityConfig(int maxToolCalls, List<String> tools) {
            this.maxToolCalls = maxToolCalls;
            this.tools = tools != null ? new ArrayList<>(tools) : new ArrayList<>();
        }

        public int getMaxToolCalls() { return maxToolCalls; }
        public void setMaxToolCalls(int maxToolCalls) { this.maxToolCalls = maxToolCalls; }
        public List<String> getTools() { return tools; }
        public void setTools(List<String> tools) { this.tools = tools != null ? tools : new ArrayList<>(); }
    }

    public static class DemoConfig {
        private boolean enabled;
        private List<String> questions = new ArrayList<>();

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public List<String> getQuestions() { return questions; }
        public void setQuestions(List<String> questions) { this.questions = questions != null ? questions : new ArrayList<>(); }
    }

    public String getDefaultIntent() {
        return defaultIntent;
    }

    public void setDefaultIntent(String defaultIntent) {
        this.defaultIntent = defaultIntent;
    }

    public Duration getPlannerTimeout() {
        return plannerTimeout;
    }

    public void setPlannerTimeout(Duration plannerTimeout) {
        this.plannerTimeout = plannerTimeout;
    }

    public Duration getHandlerTimeout() {
        return handlerTimeout;
    }

    public void setHandlerTimeout(Duration handlerTimeout) {
        this.handlerTimeout = handlerTimeout;
    }

    public int getHandlerConcurrency() {
        return handlerConcurrency;
    }

    public void setHandlerConcurrency(int handlerConcurrency) {
        this.handlerConcurrency = handlerConcurrency;
    }

    public int getHandlerMaxPoolSize() {
        return handlerMaxPoolSize;
    }

    public void setHandlerMaxPoolSize(int handlerMaxPoolSize) {
        this.handlerMaxPoolSize = handlerMaxPoolSize;
    }

    public Map<String, CapabilityConfig> getCapabilities() {
        return capabilities;
    }

    public void setCapabilities(Map<String, CapabilityConfig> capabilities) {
        if (capabilities == null) {
            return;
        }
        this.capabilities = new HashMap<>(capabilities);
    }

    /**
     * Capability settings for an intent, or an empty config when none is configured.
     */
    public CapabilityConfig getCapabilityConfig(String intent) {
        if (intent == null) {
            return new CapabilityConfig();
        }
        CapabilityConfig config = capabilities.get(intent.toLowerCase(Locale.ROOT));
        return config != null ? config : new CapabilityConfig();
    }

    public DemoConfig getDemo() {
        return demo;
    }

    public void setDemo(DemoConfig demo) {
        this.demo = demo != null ? demo : new DemoConfig();
    }
}
