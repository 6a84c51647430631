package com.scout.run;

import com.scout.orchestration.CancellationSignal;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class OrchestrationRunHubTest {

    private final OrchestrationRunHub hub = new OrchestrationRunHub();

    @Test
    void testCreateRunUsesRequestedIdOrGeneratesOne() {
        assertEquals("run-1", hub.createRun(" run-1 "));
        String generated = hub.createRun(null);

        assertFalse(generated.isBlank());
        assertTrue(hub.isActive("run-1"));
        assertTrue(hub.isActive(generated));
    }

    @Test
    void testDuplicateActiveRunIsRejected() {
        hub.createRun("run-1");

        DuplicateRunException ex = assertThrows(DuplicateRunException.class, () -> hub.createRun("run-1"));
        assertEquals("Run run-1 is already in progress", ex.getMessage());
    }

    @Test
    void testCancelFlipsSignalOfActiveRun() {
        String runId = hub.createRun("run-1");
        CancellationSignal signal = hub.signal(runId);

        assertTrue(hub.cancelRun(runId));
        assertTrue(signal.isCancelled());
        assertFalse(hub.cancelRun("unknown"));
    }

    @Test
    void testCompletedRunIsForgotten() {
        hub.createRun("run-1");
        hub.completeRun("run-1");

        assertFalse(hub.isActive("run-1"));
        assertFalse(hub.cancelRun("run-1"));
        assertThrows(IllegalArgumentException.class, () -> hub.signal("run-1"));
        assertEquals("run-1", hub.createRun("run-1"));
    }
}
