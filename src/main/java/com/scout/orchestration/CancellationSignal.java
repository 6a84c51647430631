package com.scout.orchestration;

/**
 * Cooperative cancellation flag for one orchestration call. The orchestrator checks it before each
 * step; a step that is already running is allowed to finish.
 */
public class CancellationSignal {

    private volatile boolean cancelled;

    public static CancellationSignal none() {
        return new CancellationSignal();
    }

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }
}
