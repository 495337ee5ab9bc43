package com.shadowdeploy.orchestrator.engine;

import java.util.Optional;

/**
 * Capability interface of a transformation engine (dbt, SQLmesh, ...).
 *
 * One implementation per backend; callers obtain engines from
 * {@link EngineFactory} and never construct them directly.
 *
 * <p>A reply with {@code success=false} is a normal return value. Methods
 * throw {@link EngineException} only when no reply could be obtained,
 * except {@link #getStatus()} and {@link #validateInstallation()}, which
 * never throw.
 */
public interface TransformationEngine {

    /** Lower-case engine identifier, e.g. {@code sqlmesh}. */
    String name();

    /** One-line description shown when listing engines. */
    String description();

    EngineResult getStatus();

    /** @param selector model/test selector, or {@code null} for everything */
    EngineResult test(String selector);

    /** @param selector model selector, or {@code null} for everything */
    EngineResult audit(String selector);

    EngineResult diff(String environment);

    EngineResult plan(String environment, boolean isProd);

    EngineResult migrate(String environment);

    boolean validateInstallation();

    /** Savings figures embedded in plan output; engines without them return empty. */
    default Optional<CostHint> parseCostHint(String planOutput) {
        return Optional.empty();
    }
}
