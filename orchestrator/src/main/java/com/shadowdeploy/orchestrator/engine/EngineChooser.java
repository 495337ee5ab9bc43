package com.shadowdeploy.orchestrator.engine;

import java.util.List;

/**
 * Interactive engine choice, consulted only when selection may prompt and
 * more than one engine is available.
 */
@FunctionalInterface
public interface EngineChooser {

    /** @return one of {@code availableEngines}, or {@code null} to decline */
    String choose(List<String> availableEngines);
}
