package com.scout.orchestration.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

class JsonProcessingServiceTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final JsonProcessingService service = new JsonProcessingService(objectMapper);

    static record TestStep(String subquery, String intent) {}

    @Test
    void testParseJsonTreeWithSurroundingProse() {
        String raw = "Here is the plan: {\"subquery\":\"find P0 tickets\", \"intent\":\"search\"} Hope it helps.";
        JsonNode tree = service.parseJsonTree("plan", raw);
        assertNotNull(tree);
        assertEquals("find P0 tickets", tree.get("subquery").asText());
        assertEquals("search", tree.get("intent").asText());
    }

    @Test
    void testParseJsonTreeFromMarkdownFence() {
        String raw = "```json\n{\"plan\": [{\"subquery\": \"a\", \"intent\": \"search\"}]}\n```";
        JsonNode tree = service.parseJsonTree("plan", raw);
        assertNotNull(tree);
        assertEquals("search", tree.get("plan").get(0).get("intent").asText());
    }

    @Test
    void testParseBareArray() {
        JsonNode tree = service.parseJsonTree("plan", "Steps: [{\"subquery\": \"a\"}, {\"subquery\": \"b\"}]");
        assertNotNull(tree);
        assertTrue(tree.isArray());
        assertEquals(2, tree.size());
    }

    @Test
    void testExtractJsonPrefersFirstBracket() {
        assertEquals("{\"a\": [1, 2]}", service.extractJson("x {\"a\": [1, 2]} y"));
        assertEquals("[{\"a\": 1}]", service.extractJson("x [{\"a\": 1}] y"));
    }

    @Test
    void testParseEmptyResponse() {
        assertNull(service.parseJsonTree("plan", ""));
        assertNull(service.parseJsonTree("plan", null));
    }

    @Test
    void testParseInvalidJson() {
        assertNull(service.parseJsonTree("plan", "{invalid-json}"));
        assertNull(service.parseJsonTree("plan", "no json at all"));
    }

    @Test
    void testToJson() {
        String json = service.toJson(new TestStep("get SHOP-2847", "retrieve"));
        assertTrue(json.contains("\"subquery\" : \"get SHOP-2847\""));
        assertTrue(json.contains("\"intent\" : \"retrieve\""));
    }
}
