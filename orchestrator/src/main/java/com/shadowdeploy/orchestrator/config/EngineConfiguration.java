package com.shadowdeploy.orchestrator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shadowdeploy.orchestrator.audit.DataOperationAuditor;
import com.shadowdeploy.orchestrator.engine.bridge.BridgeSettings;
import com.shadowdeploy.orchestrator.engine.bridge.SubprocessBridge;
import com.shadowdeploy.orchestrator.engine.impl.DbtEngine;
import com.shadowdeploy.orchestrator.engine.impl.SqlMeshEngine;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Wires the feature-flag snapshot, the bridges and one engine bean per backend.
 *
 * The flag file is read once at startup; changing it requires a restart.
 */
@Configuration
public class EngineConfiguration {

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    FeatureFlags featureFlags(@Value("${shadowdeploy.feature-flags-path}") Path flagsFile,
                              EngineProperties engines) {
        return FeatureFlagLoader.load(flagsFile, engines.primary());
    }

    @Bean
    BridgeSettings bridgeSettings(@Value("${shadowdeploy.project-path}") Path projectPath,
                                  @Value("${shadowdeploy.bridge.timeout-ms:300000}") long timeoutMs,
                                  @Value("${shadowdeploy.bridge.kill-grace-ms:5000}") long killGraceMs) {
        return new BridgeSettings(projectPath, Duration.ofMillis(timeoutMs), Duration.ofMillis(killGraceMs));
    }

    @Bean
    SqlMeshEngine sqlMeshEngine(BridgeSettings settings, FeatureFlags flags, EngineProperties engines,
                                ObjectMapper objectMapper, MeterRegistry meterRegistry,
                                DataOperationAuditor auditor) {
        return new SqlMeshEngine(bridge(SqlMeshEngine.NAME, settings, flags, engines,
                objectMapper, meterRegistry, auditor));
    }

    @Bean
    DbtEngine dbtEngine(BridgeSettings settings, FeatureFlags flags, EngineProperties engines,
                        ObjectMapper objectMapper, MeterRegistry meterRegistry,
                        DataOperationAuditor auditor) {
        return new DbtEngine(bridge(DbtEngine.NAME, settings, flags, engines,
                objectMapper, meterRegistry, auditor));
    }

    private static SubprocessBridge bridge(String engine, BridgeSettings settings, FeatureFlags flags,
                                           EngineProperties engines, ObjectMapper objectMapper,
                                           MeterRegistry meterRegistry, DataOperationAuditor auditor) {
        List<String> command = engines.command(engine);
        if (command.isEmpty()) {
            command = List.of("python3", "scripts/" + engine + "_bridge.py");
        }
        return new SubprocessBridge(engine, command, settings, flags, objectMapper, meterRegistry, auditor);
    }
}
