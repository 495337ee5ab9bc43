package com.shadowdeploy.orchestrator.api.dto;

import com.shadowdeploy.orchestrator.model.Deployment;

import java.time.Instant;
import java.util.List;

/**
 * Response body for POST /deployments, GET /deployments/{id} and the
 * history listing.
 */
public record DeploymentResponse(
        String             id,
        String             environment,
        String             engine,
        String             status,
        String             error,
        String             rollbackError,
        Instant            startedAt,
        Instant            completedAt,
        Instant            failedAt,
        Long               durationMs,
        List<StepResponse> steps
) {
    public static DeploymentResponse from(Deployment d) {
        return new DeploymentResponse(
                d.getId(),
                d.getEnvironment(),
                d.getEngine(),
                d.getStatus().wireName(),
                d.getError(),
                d.getRollbackError(),
                d.getStartedAt(),
                d.getCompletedAt(),
                d.getFailedAt(),
                d.getDurationMs(),
                d.getSteps().stream().map(StepResponse::from).toList()
        );
    }
}
