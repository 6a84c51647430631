package com.scout.api;

import com.scout.orchestration.registry.CapabilityRegistry;

import java.util.Map;

public record CapabilitiesResponse(
        String defaultIntent,
        Map<String, String> intents
) {

    public static CapabilitiesResponse from(CapabilityRegistry registry) {
        return new CapabilitiesResponse(registry.defaultIntent(), registry.descriptions());
    }
}
