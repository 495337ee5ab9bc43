package com.shadowdeploy.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

/**
 * The named stages of a deployment, in execution order.
 *
 * ROLLBACK is not part of the forward sequence; it is appended only after
 * one of the forward stages has failed.
 */
public enum StepName {
    PRE_VALIDATION,     // tests, audits and diff against the live environment
    CREATE_SHADOW,      // plan materialized into an isolated location
    SHADOW_VALIDATION,  // audits and tests re-run against the shadow
    SAFETY_CHECKS,      // diff re-checked for destructive changes
    ATOMIC_SWAP,        // migrate promotes the shadow into the environment
    POST_VALIDATION,    // status probe against the now-live environment
    ROLLBACK;

    /** The forward sequence driven by the orchestrator. */
    public static final List<StepName> SEQUENCE = List.of(
            PRE_VALIDATION,
            CREATE_SHADOW,
            SHADOW_VALIDATION,
            SAFETY_CHECKS,
            ATOMIC_SWAP,
            POST_VALIDATION
    );

    /** Lower-case name used in API payloads and the history store, e.g. "atomic_swap". */
    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
