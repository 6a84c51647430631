package com.scout.api;

/**
 * Outcome of a cancel request. A requested cancellation takes effect before the run's next step.
 */
public record CancelRunResponse(
        String runId,
        String status,
        String message
) {
    public static CancelRunResponse requested(String runId) {
        return new CancelRunResponse(runId, "cancelling", "Cancellation requested; the current step will finish first.");
    }

    public static CancelRunResponse unknown(String runId) {
        return new CancelRunResponse(runId, "not-found", "No run in progress with this id.");
    }
}
