package com.shadowdeploy.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonRawValue;
import com.shadowdeploy.orchestrator.model.DeploymentStep;
import com.shadowdeploy.orchestrator.model.StepName;
import com.shadowdeploy.orchestrator.model.StepState;

import java.time.Instant;

/**
 * One stage of a deployment. {@code result} is the stage output embedded as
 * JSON (validation flags, plan output, raw engine stdout/stderr on failure).
 */
public record StepResponse(
        StepName  name,
        StepState status,
        Instant   startedAt,
        Instant   finishedAt,
        Long      durationMs,
        @JsonRawValue String result,
        String    error
) {
    public static StepResponse from(DeploymentStep s) {
        return new StepResponse(
                s.getName(),
                s.getState(),
                s.getStartedAt(),
                s.getFinishedAt(),
                s.getDurationMs(),
                s.getResultJson(),
                s.getError()
        );
    }
}
