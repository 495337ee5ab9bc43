package com.shadowdeploy.orchestrator.engine.bridge;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Per-bridge process settings.
 *
 * @param projectPath transformation project the engine operates on
 * @param timeout     wall-clock limit of one call; the process is stopped after it
 * @param killGrace   time between the graceful stop signal and the forced kill
 */
public record BridgeSettings(Path projectPath, Duration timeout, Duration killGrace) {

    public static final Duration DEFAULT_TIMEOUT    = Duration.ofMillis(300_000);
    public static final Duration DEFAULT_KILL_GRACE = Duration.ofMillis(5_000);

    public BridgeSettings {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) timeout = DEFAULT_TIMEOUT;
        if (killGrace == null || killGrace.isNegative()) killGrace = DEFAULT_KILL_GRACE;
    }

    public static BridgeSettings defaults(Path projectPath) {
        return new BridgeSettings(projectPath, DEFAULT_TIMEOUT, DEFAULT_KILL_GRACE);
    }
}
