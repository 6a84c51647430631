package com.scout.run;

import com.scout.orchestration.CancellationSignal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks in-flight orchestration runs so they can be cancelled by id. A run is registered when it
 * starts and removed as soon as it completes; nothing outlives the call.
 */
@Slf4j
@Component
public class OrchestrationRunHub {

    private final Map<String, CancellationSignal> runs = new ConcurrentHashMap<>();

    /**
     * Registers a run under the given id, or under a random id when none is given.
     *
     * @throws DuplicateRunException when a run with the same id is still in flight
     */
    public String createRun(@Nullable String requestedRunId) {
        String runId = StringUtils.hasText(requestedRunId) ? requestedRunId.trim() : UUID.randomUUID().toString();
        if (runs.putIfAbsent(runId, new CancellationSignal()) != null) {
            throw new DuplicateRunException(runId);
        }
        return runId;
    }

    public CancellationSignal signal(String runId) {
        CancellationSignal signal = runs.get(runId);
        if (signal == null) {
            throw new IllegalArgumentException("Unknown run " + runId);
        }
        return signal;
    }

    public boolean cancelRun(String runId) {
        CancellationSignal signal = runs.get(runId);
        if (signal == null) {
            return false;
        }
        signal.cancel();
        log.info("Cancellation requested for run {}.", runId);
        return true;
    }

    public void completeRun(String runId) {
        runs.remove(runId);
    }

    public boolean isActive(String runId) {
        return runs.containsKey(runId);
    }
}
