package com.shadowdeploy.orchestrator.engine.bridge;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shadowdeploy.orchestrator.audit.DataOperationAuditor;
import com.shadowdeploy.orchestrator.config.FeatureFlags;
import com.shadowdeploy.orchestrator.engine.EngineException;
import com.shadowdeploy.orchestrator.engine.EngineException.Kind;
import com.shadowdeploy.orchestrator.engine.EngineResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

/**
 * Runs the bridge against real {@code /bin/sh} scripts standing in for the
 * engine executables.
 */
@DisabledOnOs(OS.WINDOWS)
class SubprocessBridgeTest {

    static final String OK_REPLY = "{\"success\":true,\"stdout\":\"plan ready\",\"stderr\":\"\",\"returncode\":0}";

    @TempDir Path dir;

    ObjectMapper         json;
    SimpleMeterRegistry  meters;
    DataOperationAuditor auditor;
    FeatureFlags         flags;

    @BeforeEach
    void setUp() {
        json    = new ObjectMapper();
        meters  = new SimpleMeterRegistry();
        auditor = mock(DataOperationAuditor.class);
        flags   = FeatureFlags.defaults("dbt").with("sqlmesh_transformations", true);
    }

    // ------------------------------------------------------------------
    // Protocol
    // ------------------------------------------------------------------

    @Test
    void call_jsonReply_isReturnedAsResult() {
        EngineResult result = bridge(script("printf '%s' '" + OK_REPLY + "'"), Duration.ofSeconds(10))
                .call("plan");

        assertThat(result.success()).isTrue();
        assertThat(result.stdout()).isEqualTo("plan ready");
        assertThat(result.returncode()).isZero();
        assertThat(meters.counter("shadowdeploy.engine.calls",
                "engine", "sqlmesh", "command", "plan", "status", "success").count()).isEqualTo(1.0);
        assertThat(meters.timer("shadowdeploy.engine.duration",
                "engine", "sqlmesh", "command", "plan").count()).isEqualTo(1);
        verify(auditor).record(eq("engine_command"), anyMap());
    }

    @Test
    void call_passesRequestEnvelopeAsLastArgumentAndProjectPathInEnvironment() throws Exception {
        Path request = dir.resolve("request.json");
        Path env     = dir.resolve("env.txt");
        String body = "printf '%s' \"$1\" > '" + request + "'; "
                + "printf '%s' \"$SHADOWDEPLOY_PROJECT_PATH\" > '" + env + "'; "
                + "printf '%s' '" + OK_REPLY + "'";

        bridge(script(body), Duration.ofSeconds(10))
                .call("plan", List.of("orders"), Map.of("environment", "staging", "auto_apply", false));

        JsonNode sent = json.readTree(request.toFile());
        assertThat(sent.path("command").asText()).isEqualTo("plan");
        assertThat(sent.path("args").get(0).asText()).isEqualTo("orders");
        assertThat(sent.path("options").path("environment").asText()).isEqualTo("staging");
        assertThat(sent.path("options").path("auto_apply").asBoolean(true)).isFalse();
        assertThat(sent.path("project_path").asText()).isEqualTo(dir.toString());
        assertThat(Files.readString(env)).isEqualTo(dir.toString());
    }

    @Test
    void call_engineReportsFailure_isReturnedNotThrown() {
        String reply = "{\"success\":false,\"stdout\":\"\",\"stderr\":\"2 tests failed\",\"returncode\":1}";

        EngineResult result = bridge(script("printf '%s' '" + reply + "'; exit 1"), Duration.ofSeconds(10))
                .call("test");

        assertThat(result.success()).isFalse();
        assertThat(result.failureReason()).isEqualTo("2 tests failed");
        assertThat(meters.counter("shadowdeploy.engine.calls",
                "engine", "sqlmesh", "command", "test", "status", "failure").count()).isEqualTo(1.0);
    }

    @Test
    void call_nonJsonReply_isProtocolError() {
        assertThatThrownBy(() -> bridge(script("echo 'SQLMesh v0.1 ready'"), Duration.ofSeconds(10)).call("info"))
                .isInstanceOf(EngineException.class)
                .satisfies(e -> assertThat(((EngineException) e).getKind()).isEqualTo(Kind.PROTOCOL_ERROR));
    }

    @Test
    void call_emptyReply_isProtocolError() {
        assertThatThrownBy(() -> bridge(script("true"), Duration.ofSeconds(10)).call("info"))
                .isInstanceOf(EngineException.class)
                .hasMessageContaining("no reply");
    }

    @Test
    void call_crashWithoutReply_isNonZeroExitWithStderr() {
        assertThatThrownBy(() -> bridge(script("echo 'ModuleNotFoundError: sqlmesh' >&2; exit 3"),
                        Duration.ofSeconds(10)).call("version"))
                .isInstanceOf(EngineException.class)
                .hasMessageContaining("exited with code 3")
                .hasMessageContaining("ModuleNotFoundError")
                .satisfies(e -> {
                    EngineException ex = (EngineException) e;
                    assertThat(ex.getKind()).isEqualTo(Kind.NON_ZERO_EXIT);
                    assertThat(ex.getEngine()).isEqualTo("sqlmesh");
                    assertThat(ex.getCommand()).isEqualTo("version");
                });
    }

    // ------------------------------------------------------------------
    // Lifecycle
    // ------------------------------------------------------------------

    @Test
    void call_exceedsTimeout_isStoppedAndReportedAsTimeout() {
        SubprocessBridge bridge = bridge(script("exec sleep 30"), Duration.ofMillis(300));
        long start = System.nanoTime();

        assertThatThrownBy(() -> bridge.call("migrate"))
                .isInstanceOf(EngineException.class)
                .satisfies(e -> assertThat(((EngineException) e).getKind()).isEqualTo(Kind.TIMEOUT));

        assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(10));
        assertThat(meters.counter("shadowdeploy.engine.calls",
                "engine", "sqlmesh", "command", "migrate", "status", "timeout").count()).isEqualTo(1.0);
    }

    @Test
    void call_ignoresStopSignal_isKilledAfterGrace() {
        SubprocessBridge bridge = new SubprocessBridge("sqlmesh", script("trap '' TERM; sleep 30"),
                new BridgeSettings(dir, Duration.ofMillis(300), Duration.ofMillis(200)),
                flags, json, meters, auditor);
        long start = System.nanoTime();

        assertThatThrownBy(() -> bridge.call("plan"))
                .isInstanceOf(EngineException.class)
                .hasMessageContaining("timed out after 300ms");

        assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(10));
    }

    @Test
    void call_flagDisabled_rejectedWithoutSpawning() {
        SubprocessBridge bridge = new SubprocessBridge("sqlmesh", List.of("/definitely/not/here"),
                BridgeSettings.defaults(dir), FeatureFlags.defaults("dbt"), json, meters, auditor);

        assertThatThrownBy(() -> bridge.call("plan"))
                .isInstanceOf(EngineException.class)
                .hasMessageContaining("sqlmesh_transformations")
                .satisfies(e -> assertThat(((EngineException) e).getKind()).isEqualTo(Kind.DISABLED));
        verifyNoInteractions(auditor);
    }

    @Test
    void call_missingExecutable_isSpawnFailure() {
        SubprocessBridge bridge = new SubprocessBridge("sqlmesh", List.of(dir.resolve("missing-bridge").toString()),
                BridgeSettings.defaults(dir), flags, json, meters, auditor);

        assertThatThrownBy(() -> bridge.call("version"))
                .isInstanceOf(EngineException.class)
                .satisfies(e -> assertThat(((EngineException) e).getKind()).isEqualTo(Kind.SPAWN_FAILED));
    }

    @Test
    void settings_invalidTimeout_fallsBackToDefault() {
        BridgeSettings settings = new BridgeSettings(dir, Duration.ZERO, null);

        assertThat(settings.timeout()).isEqualTo(BridgeSettings.DEFAULT_TIMEOUT);
        assertThat(settings.killGrace()).isEqualTo(BridgeSettings.DEFAULT_KILL_GRACE);
    }

    // ------------------------------------------------------------------

    private SubprocessBridge bridge(List<String> executable, Duration timeout) {
        return new SubprocessBridge("sqlmesh", executable,
                new BridgeSettings(dir, timeout, Duration.ofMillis(500)), flags, json, meters, auditor);
    }

    /** {@code sh -c body bridge <request-json>}: the request arrives as {@code $1}. */
    private static List<String> script(String body) {
        return List.of("/bin/sh", "-c", body, "bridge");
    }
}
