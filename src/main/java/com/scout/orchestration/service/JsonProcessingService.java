package com.scout.orchestration.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Extracts JSON from free-form model replies. Replies often wrap the payload in prose or
 * markdown fences, so parsing starts at the first bracket and ends at the matching last one.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JsonProcessingService {

    private static final int SNIPPET_LENGTH = 240;

    private final ObjectMapper objectMapper;

    /**
     * Parses the first JSON object or array embedded in {@code raw}.
     *
     * @return the parsed tree, or {@code null} when the reply holds no valid JSON
     */
    public @Nullable JsonNode parseJsonTree(String label, @Nullable String raw) {
        if (!StringUtils.hasText(raw)) {
            log.warn("Empty response for {}. Unable to parse JSON.", label);
            return null;
        }
        try {
            return objectMapper.readTree(extractJson(raw));
        } catch (Exception ex) {
            log.warn("Failed to parse {} response as JSON. Snippet: {}", label, truncate(raw));
            return null;
        }
    }

    String extractJson(String raw) {
        String trimmed = raw.trim();
        int objectStart = trimmed.indexOf('{');
        int arrayStart = trimmed.indexOf('[');
        boolean array = arrayStart >= 0 && (objectStart < 0 || arrayStart < objectStart);
        int start = array ? arrayStart : objectStart;
        int end = array ? trimmed.lastIndexOf(']') : trimmed.lastIndexOf('}');
        if (start >= 0 && end > start) {
            return trimmed.substring(start, end + 1);
        }
        return trimmed;
    }

    private String truncate(@Nullable String value) {
        if (value == null) {
            return "";
        }
        String normalized = value.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= SNIPPET_LENGTH) {
            return normalized;
        }
        return normalized.substring(0, SNIPPET_LENGTH) + "...";
    }

    public String toJson(Object value) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            log.warn("Failed to serialize {} as JSON: {}", value.getClass().getSimpleName(), ex.getMessage());
            return String.valueOf(value);
        }
    }
}
