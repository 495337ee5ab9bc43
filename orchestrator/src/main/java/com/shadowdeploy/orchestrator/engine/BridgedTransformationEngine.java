package com.shadowdeploy.orchestrator.engine;

import com.shadowdeploy.orchestrator.engine.bridge.SubprocessBridge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base for engines that talk to their backend through a {@link SubprocessBridge}.
 * Folds bridge failures into the non-throwing contract of status and
 * installation checks.
 */
public abstract class BridgedTransformationEngine implements TransformationEngine {

    private static final Logger log = LoggerFactory.getLogger(BridgedTransformationEngine.class);

    protected final SubprocessBridge bridge;

    protected BridgedTransformationEngine(SubprocessBridge bridge) {
        this.bridge = bridge;
    }

    @Override
    public String name() {
        return bridge.engine();
    }

    /** Engine command that reports project health. */
    protected abstract EngineResult fetchStatus();

    @Override
    public final EngineResult getStatus() {
        try {
            return fetchStatus();
        } catch (EngineException e) {
            log.warn("Status check failed for {}: {}", name(), e.getMessage());
            return EngineResult.failure(e.getMessage());
        }
    }

    @Override
    public boolean validateInstallation() {
        try {
            return bridge.call("version").success();
        } catch (EngineException e) {
            log.warn("{} installation check failed: {}", name(), e.getMessage());
            return false;
        }
    }
}
