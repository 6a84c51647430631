package com.scout.api;

import com.scout.orchestration.OrchestratorService;
import com.scout.orchestration.model.OrchestrationResult;
import com.scout.orchestration.registry.CapabilityRegistry;
import com.scout.run.OrchestrationRunHub;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/scout")
public class ScoutController {

    private final OrchestratorService orchestratorService;
    private final OrchestrationRunHub runHub;
    private final CapabilityRegistry registry;

    public ScoutController(OrchestratorService orchestratorService,
                           OrchestrationRunHub runHub,
                           CapabilityRegistry registry) {
        this.orchestratorService = orchestratorService;
        this.runHub = runHub;
        this.registry = registry;
    }

    @PostMapping("/ask")
    public AskResponse ask(@Valid @RequestBody AskRequest request) {
        String runId = runHub.createRun(request.runId());
        try {
            OrchestrationResult result = orchestratorService.run(request.question(), runHub.signal(runId));
            return AskResponse.from(runId, result);
        } finally {
            runHub.completeRun(runId);
        }
    }

    @PostMapping("/cancel/{runId}")
    public CancelRunResponse cancel(@PathVariable String runId) {
        return runHub.cancelRun(runId) ? CancelRunResponse.requested(runId) : CancelRunResponse.unknown(runId);
    }

    @GetMapping("/capabilities")
    public CapabilitiesResponse capabilities() {
        return CapabilitiesResponse.from(registry);
    }
}
