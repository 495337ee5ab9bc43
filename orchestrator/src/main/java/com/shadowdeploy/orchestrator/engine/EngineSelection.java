package com.shadowdeploy.orchestrator.engine;

/**
 * Inputs to engine selection, in precedence order.
 *
 * @param explicitEngine engine named by the caller directly
 * @param requestEngine  engine resolved from request metadata
 * @param interactive    whether an interactive choice may be made
 */
public record EngineSelection(String explicitEngine, String requestEngine, boolean interactive) {

    public static EngineSelection explicit(String engine) {
        return new EngineSelection(engine, null, false);
    }

    public static EngineSelection fromRequest(String engine) {
        return new EngineSelection(null, engine, false);
    }
}
