package com.scout.tools;

import static com.scout.orchestration.OrchestrationConstants.TOOL_GET_CONFLUENCE_DOC;
import static com.scout.orchestration.OrchestrationConstants.TOOL_GET_TICKET_DETAILS;

import com.scout.data.ConfluenceDoc;
import com.scout.data.JiraTicket;
import com.scout.data.MockDataRepository;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;

import java.util.Optional;

/**
 * Exact-id retrieval of tickets and documents.
 */
public class RetrieveTools {

    private final MockDataRepository repository;

    public RetrieveTools(MockDataRepository repository) {
        this.repository = repository;
    }

    @Tool(name = TOOL_GET_TICKET_DETAILS, description = "Get full details for a specific Jira ticket.")
    public String getTicketDetails(@ToolParam(description = "Ticket id, e.g. SHOP-2847") String ticketId) {
        Optional<JiraTicket> found = repository.findTicket(ticketId);
        if (found.isEmpty()) {
            return "Ticket " + ticketId + " not found";
        }
        JiraTicket ticket = found.get();
        return """
                Ticket %s: %s
                Status: %s
                Assignee: %s
                Priority: %s
                Created: %s
                Updated: %s

                Description:
                %s""".formatted(ticketId, ticket.title(), ticket.status(), ticket.assignee(), ticket.priority(),
                ticket.created(), ticket.updated(), ticket.description());
    }

    @Tool(name = TOOL_GET_CONFLUENCE_DOC, description = "Get full content of a Confluence document.")
    public String getConfluenceDoc(@ToolParam(description = "Document key, e.g. checkout-rewrite") String docKey) {
        Optional<ConfluenceDoc> found = repository.findDoc(docKey);
        if (found.isEmpty()) {
            return "Document '" + docKey + "' not found. Available keys: " + String.join(", ", repository.docKeys());
        }
        ConfluenceDoc doc = found.get();
        return """
                %s
                Last updated: %s

                Content:
                %s""".formatted(doc.title(), doc.updated(), doc.content());
    }
}
