package com.scout.tools;

import static com.scout.orchestration.OrchestrationConstants.TOOL_SEARCH_CONFLUENCE;
import static com.scout.orchestration.OrchestrationConstants.TOOL_SEARCH_JIRA;

import com.scout.data.ConfluenceDoc;
import com.scout.data.JiraTicket;
import com.scout.data.MockDataRepository;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Keyword search over Jira tickets and Confluence docs. Matching is a case-insensitive substring test.
 */
public class SearchTools {

    private final MockDataRepository repository;

    public SearchTools(MockDataRepository repository) {
        this.repository = repository;
    }

    @Tool(name = TOOL_SEARCH_JIRA, description = "Search Jira tickets by keyword.")
    public String searchJira(@ToolParam(description = "Keyword to look for") String query) {
        String needle = normalize(query);
        List<String> results = new ArrayList<>();
        for (Map.Entry<String, JiraTicket> entry : repository.dataset().tickets().entrySet()) {
            JiraTicket ticket = entry.getValue();
            if (contains(ticket.title(), needle)
                    || contains(ticket.description(), needle)
                    || contains(ticket.priority(), needle)
                    || contains(ticket.status(), needle)
                    || contains(ticket.assignee(), needle)) {
                results.add(entry.getKey() + ": " + ticket.title()
                        + " (Status: " + ticket.status() + ", Priority: " + ticket.priority()
                        + ", Assignee: " + ticket.assignee() + ")");
            }
        }
        if (results.isEmpty()) {
            return "No Jira tickets found matching '" + query + "'";
        }
        return "Found " + results.size() + " ticket(s):\n" + String.join("\n", results);
    }

    @Tool(name = TOOL_SEARCH_CONFLUENCE, description = "Search Confluence documentation.")
    public String searchConfluence(@ToolParam(description = "Keyword to look for") String query) {
        String needle = normalize(query);
        List<String> results = new ArrayList<>();
        for (Map.Entry<String, ConfluenceDoc> entry : repository.dataset().docs().entrySet()) {
            ConfluenceDoc doc = entry.getValue();
            if (contains(doc.title(), needle) || contains(doc.content(), needle)) {
                results.add("• " + doc.title() + " (Key: " + entry.getKey() + ", Updated: " + doc.updated() + ")");
            }
        }
        if (results.isEmpty()) {
            return "No Confluence docs found matching '" + query + "'";
        }
        return "Found " + results.size() + " document(s):\n" + String.join("\n", results);
    }

    private static String normalize(String query) {
        return query == null ? "" : query.toLowerCase(Locale.ROOT);
    }

    private static boolean contains(String field, String needle) {
        return field != null && field.toLowerCase(Locale.ROOT).contains(needle);
    }
}
