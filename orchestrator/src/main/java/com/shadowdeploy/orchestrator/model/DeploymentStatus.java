package com.shadowdeploy.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Overall state of a deployment.
 *
 * IN_PROGRESS only exists while the orchestrator owns the record; a deployment
 * is persisted once it reaches COMPLETED or FAILED.
 */
public enum DeploymentStatus {
    IN_PROGRESS,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this != IN_PROGRESS;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
