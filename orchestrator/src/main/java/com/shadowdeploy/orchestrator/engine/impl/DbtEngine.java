package com.shadowdeploy.orchestrator.engine.impl;

import com.shadowdeploy.orchestrator.engine.BridgedTransformationEngine;
import com.shadowdeploy.orchestrator.engine.EngineResult;
import com.shadowdeploy.orchestrator.engine.bridge.SubprocessBridge;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * dbt adapter. dbt has no virtual environments, so the shadow is a compiled
 * plan against the target and the swap is a full {@code build}.
 *
 * Mapping onto dbt commands:
 * <pre>
 *   status   → debug
 *   test     → test [--select selector]
 *   audit    → test --select test_type:data [selector]
 *   diff     → ls --select state:modified+
 *   plan     → compile
 *   migrate  → build
 * </pre>
 */
public class DbtEngine extends BridgedTransformationEngine {

    public static final String NAME = "dbt";

    public DbtEngine(SubprocessBridge bridge) {
        super(bridge);
    }

    @Override
    public String description() {
        return "dbt - Data Build Tool (traditional, widely adopted)";
    }

    @Override
    protected EngineResult fetchStatus() {
        return bridge.call("debug");
    }

    @Override
    public EngineResult test(String selector) {
        List<String> args = new ArrayList<>();
        if (selector != null && !selector.isBlank()) {
            args.add("--select");
            args.add(selector);
        }
        return bridge.call("test", args, Map.of());
    }

    @Override
    public EngineResult audit(String selector) {
        List<String> args = new ArrayList<>(List.of("--select", "test_type:data"));
        if (selector != null && !selector.isBlank()) {
            args.add(selector);
        }
        return bridge.call("test", args, Map.of());
    }

    @Override
    public EngineResult diff(String environment) {
        return bridge.call("ls", List.of("--select", "state:modified+"), Map.of("target", environment));
    }

    @Override
    public EngineResult plan(String environment, boolean isProd) {
        return bridge.call("compile", List.of(), Map.of("target", environment, "prod", isProd));
    }

    @Override
    public EngineResult migrate(String environment) {
        return bridge.call("build", List.of(), Map.of("target", environment));
    }
}
