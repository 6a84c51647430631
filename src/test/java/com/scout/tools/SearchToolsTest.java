package com.scout.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scout.data.MockDataRepository;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SearchToolsTest {

    private final SearchTools tools = new SearchTools(MockDataRepository.loadDefault(new ObjectMapper()));

    @Test
    void testSearchJiraByPriority() {
        assertEquals("Found 1 ticket(s):\n"
                        + "SHOP-2847: Safari checkout crashes on iOS 17 (Status: In Review, Priority: P0, Assignee: Alice Chen)",
                tools.searchJira("P0"));
    }

    @Test
    void testSearchJiraIsCaseInsensitive() {
        String result = tools.searchJira("PAYMENT");

        assertTrue(result.contains("SHOP-2847"));
        assertTrue(result.contains("SHOP-2901"));
        assertFalse(result.contains("SHOP-2955"));
    }

    @Test
    void testSearchJiraWithoutMatches() {
        assertEquals("No Jira tickets found matching 'kubernetes'", tools.searchJira("kubernetes"));
    }

    @Test
    void testSearchConfluence() {
        String result = tools.searchConfluence("safari");

        assertTrue(result.startsWith("Found 2 document(s):\n"));
        assertTrue(result.contains("• Checkout Rewrite Q2 2025 (Key: checkout-rewrite, Updated: 2025-01-15)"));
        assertTrue(result.contains("mobile-strategy"));
        assertEquals("No Confluence docs found matching 'roadmap'", tools.searchConfluence("roadmap"));
    }
}
