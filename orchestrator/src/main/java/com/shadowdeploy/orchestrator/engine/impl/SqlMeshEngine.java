package com.shadowdeploy.orchestrator.engine.impl;

import com.shadowdeploy.orchestrator.engine.BridgedTransformationEngine;
import com.shadowdeploy.orchestrator.engine.CostHint;
import com.shadowdeploy.orchestrator.engine.EngineResult;
import com.shadowdeploy.orchestrator.engine.bridge.SubprocessBridge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * SQLmesh adapter. Plans are created without auto-apply; the swap happens in
 * {@link #migrate(String)}.
 *
 * Bridge commands used: info, test, audit, diff, plan, migrate, version.
 */
public class SqlMeshEngine extends BridgedTransformationEngine {

    private static final Logger log = LoggerFactory.getLogger(SqlMeshEngine.class);

    public static final String NAME = "sqlmesh";

    private static final Pattern VIRTUAL_HOURS = Pattern.compile("Virtual execution: (\\d+) compute hours saved");
    private static final Pattern SAVINGS       = Pattern.compile("Cost savings: (\\d+)%");

    public SqlMeshEngine(SubprocessBridge bridge) {
        super(bridge);
    }

    @Override
    public String description() {
        return "SQLmesh - Cost-optimized with virtual environments (30-50% savings)";
    }

    @Override
    protected EngineResult fetchStatus() {
        return bridge.call("info");
    }

    @Override
    public EngineResult test(String selector) {
        return bridge.call("test", selectorArgs(selector), Map.of());
    }

    @Override
    public EngineResult audit(String selector) {
        return bridge.call("audit", selectorArgs(selector), Map.of());
    }

    @Override
    public EngineResult diff(String environment) {
        return bridge.call("diff", List.of(), Map.of("environment", environment));
    }

    @Override
    public EngineResult plan(String environment, boolean isProd) {
        Map<String, Object> options = new LinkedHashMap<>();
        options.put("environment", environment);
        options.put("prod", isProd);
        options.put("auto_apply", false);

        EngineResult result = bridge.call("plan", List.of(), options);
        if (result.success()) {
            parseCostHint(result.stdoutOrEmpty()).ifPresent(hint ->
                    log.info("SQLmesh plan for {}: {} compute hours saved, estimated savings {}%",
                            environment, hint.virtualHoursSaved(), hint.savingsPercentage()));
        }
        return result;
    }

    @Override
    public EngineResult migrate(String environment) {
        return bridge.call("migrate", List.of(), Map.of("environment", environment));
    }

    @Override
    public Optional<CostHint> parseCostHint(String planOutput) {
        if (planOutput == null) {
            return Optional.empty();
        }
        Matcher hours   = VIRTUAL_HOURS.matcher(planOutput);
        Matcher savings = SAVINGS.matcher(planOutput);
        boolean hasHours   = hours.find();
        boolean hasSavings = savings.find();
        if (!hasHours && !hasSavings) {
            return Optional.empty();
        }
        try {
            return Optional.of(new CostHint(
                    hasHours ? Long.parseLong(hours.group(1)) : 0,
                    hasSavings ? Long.parseLong(savings.group(1)) : 0));
        } catch (NumberFormatException e) {
            log.warn("Ignoring out-of-range cost figures in SQLmesh plan output: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private static List<String> selectorArgs(String selector) {
        return selector == null || selector.isBlank() ? List.of() : List.of(selector);
    }
}
