package com.scout.orchestration;

import java.util.List;

public final class OrchestrationConstants {

    private OrchestrationConstants() {
        // Private constructor to prevent instantiation
    }

    // Intents
    public static final String INTENT_SEARCH = "search";
    public static final String INTENT_RETRIEVE = "retrieve";
    public static final String INTENT_ANALYZE = "analyze";

    // Tool names
    public static final String TOOL_SEARCH_JIRA = "search_jira";
    public static final String TOOL_SEARCH_CONFLUENCE = "search_confluence";
    public static final String TOOL_GET_TICKET_DETAILS = "get_ticket_details";
    public static final String TOOL_GET_CONFLUENCE_DOC = "get_confluence_doc";
    public static final String TOOL_GET_METRIC = "get_metric";
    public static final String TOOL_COMPARE_METRICS = "compare_metrics";
    public static final String TOOL_LIST_AVAILABLE_METRICS = "list_available_metrics";

    public static final List<String> SEARCH_TOOLS = List.of(TOOL_SEARCH_JIRA, TOOL_SEARCH_CONFLUENCE);
    public static final List<String> RETRIEVE_TOOLS = List.of(TOOL_GET_TICKET_DETAILS, TOOL_GET_CONFLUENCE_DOC);
    public static final List<String> ANALYZE_TOOLS = List.of(TOOL_GET_METRIC, TOOL_COMPARE_METRICS, TOOL_LIST_AVAILABLE_METRICS);

    // Tool call budgets per answer
    public static final int SEARCH_MAX_TOOL_CALLS = 4;
    public static final int RETRIEVE_MAX_TOOL_CALLS = 3;
    public static final int ANALYZE_MAX_TOOL_CALLS = 4;

    // LLM request purposes
    public static final String PURPOSE_PLAN = "plan";
    public static final String PURPOSE_PLAN_RETRY = "plan-retry";
    public static final String PURPOSE_CAPABILITY = "capability";

    // Default messages
    public static final String STEP_FAILED_MESSAGE = "Step %d (%s) could not be completed: %s";
    public static final String CANCELLED_BEFORE_ANY_STEP = "Orchestration cancelled before any step completed.";
    public static final String TOOL_BUDGET_EXHAUSTED_MESSAGE = "Tool call budget of %d calls is exhausted. "
            + "Do not call any more tools; answer now using the information already gathered.";
    public static final String INVALID_JSON_RETRY_PROMPT = "\nYour last response was invalid JSON. Return only valid JSON.";

    // Capability descriptions
    public static final String SEARCH_DESCRIPTION = "Use when you need to FIND tickets or docs using keywords "
            + "(e.g., \"find Safari issues\", \"search for checkout docs\")";
    public static final String RETRIEVE_DESCRIPTION = "Use when you have specific IDs and need DETAILS "
            + "(e.g., \"get ticket SHOP-2847\", \"get doc checkout-rewrite\")";
    public static final String ANALYZE_DESCRIPTION = "Use when you need to examine METRICS or TRENDS "
            + "(e.g., \"how are conversions trending?\", \"compare mobile vs desktop\")";

    public static final String PLANNING_EXAMPLES = """
            Examples:
            - "What tickets are about Safari?" -> search
            - "Get details for SHOP-2847" -> retrieve
            - "Are mobile conversions down?" -> analyze
            - "Find checkout issues and check if conversions dropped" -> search (find issues), analyze (check metrics)
            """;

    // Prompts
    public static final String PLANNER_SYSTEM_PROMPT = """
            You are the planning agent. Decompose the user question into an ordered execution plan.
            Each step has a subquery and exactly one intent from the list of available intents.
            Later steps receive the answers of earlier steps, so order steps by dependency.
            Use a single step when the question needs only one capability.
            Return only JSON that matches the requested format.
            """;

    public static final String PLAN_JSON_FORMAT = """
            {"plan": [{"subquery": "...", "intent": "..."}]}""";

    public static final String PLANNER_USER_TEMPLATE = """
            Question:
            {question}

            {intents}

            Format:
            {format}
            """;

    public static final String SEARCH_SYSTEM_PROMPT = """
            You are the search agent. Search for relevant information in Jira tickets and Confluence docs.
            Use the search tools with short keywords and summarize what you found.
            If nothing matches, say so plainly.
            """;

    public static final String RETRIEVE_SYSTEM_PROMPT = """
            You are the retrieve agent. Retrieve detailed information for specific tickets or documents by id.
            Take ids from the question or from the results of previous steps.
            Report the details you retrieved; if an item does not exist, say so plainly.
            """;

    public static final String ANALYZE_SYSTEM_PROMPT = """
            You are the analyze agent. Analyze metrics, trends and data patterns.
            Look up or compare the relevant metrics and explain the trend with its numbers.
            If a metric does not exist, list what is available.
            """;

    public static final String CAPABILITY_USER_TEMPLATE = """
            Question:
            {question}

            Results from previous steps:
            {context}
            """;
}
