package com.scout.api;

import jakarta.validation.constraints.NotBlank;

public record AskRequest(
        @NotBlank String question,
        String runId
) {
}
