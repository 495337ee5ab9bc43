package com.shadowdeploy.orchestrator.api;

import com.shadowdeploy.orchestrator.api.dto.DeployRequest;
import com.shadowdeploy.orchestrator.api.dto.DeploymentResponse;
import com.shadowdeploy.orchestrator.engine.EngineSelection;
import com.shadowdeploy.orchestrator.engine.TransformationEngine;
import com.shadowdeploy.orchestrator.model.Deployment;
import com.shadowdeploy.orchestrator.service.DeploymentOrchestrator;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

/**
 * REST API for deployments.
 *
 * POST /deployments          run a deployment; engine resolved by {@link EngineSelectionFilter}
 * GET  /deployments/{id}     one terminal deployment with its steps
 * GET  /deployments?limit=N  most recent N deployments, newest first
 */
@RestController
@RequestMapping("/deployments")
public class DeploymentController {

    private final DeploymentOrchestrator orchestrator;

    public DeploymentController(DeploymentOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    /**
     * Run a deployment synchronously and return its terminal state.
     *
     * Example:
     *   curl -X POST http://localhost:8080/deployments \
     *     -H "Content-Type: application/json" \
     *     -H "X-Transform-Engine: sqlmesh" \
     *     -d '{"environment":"staging"}'
     *
     * A failed deployment is still 201: the deployment record was created.
     */
    @PostMapping
    public ResponseEntity<DeploymentResponse> deploy(
            @RequestBody DeployRequest req,
            @RequestAttribute(name = EngineSelectionFilter.ENGINE_ATTRIBUTE, required = false)
            TransformationEngine engine) {
        Deployment deployment = engine != null
                ? orchestrator.deploy(req.environment(), engine)
                : orchestrator.deploy(req.environment(), EngineSelection.fromRequest(req.engine()));
        return ResponseEntity.status(HttpStatus.CREATED).body(DeploymentResponse.from(deployment));
    }

    @GetMapping("/{id}")
    public DeploymentResponse getDeployment(@PathVariable String id) {
        return orchestrator.findById(id)
                .map(DeploymentResponse::from)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "Deployment not found: " + id));
    }

    @GetMapping
    public List<DeploymentResponse> history(@RequestParam(defaultValue = "10") int limit) {
        return orchestrator.history(limit).stream()
                .map(DeploymentResponse::from)
                .toList();
    }
}
