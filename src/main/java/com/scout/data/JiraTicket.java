package com.scout.data;

public record JiraTicket(
        String title,
        String status,
        String assignee,
        String priority,
        String description,
        String created,
        String updated
) {
}
