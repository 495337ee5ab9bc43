package com.shadowdeploy.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Execution state of a single deployment step.
 *
 * Transitions:
 *   RUNNING → COMPLETED (engine call succeeded and the stage's checks passed)
 *   RUNNING → FAILED    (engine call failed, timed out, or a check rejected the change)
 */
public enum StepState {
    RUNNING,
    COMPLETED,
    FAILED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
