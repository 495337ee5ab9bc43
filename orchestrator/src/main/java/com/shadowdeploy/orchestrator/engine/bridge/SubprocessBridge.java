package com.shadowdeploy.orchestrator.engine.bridge;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shadowdeploy.orchestrator.audit.DataOperationAuditor;
import com.shadowdeploy.orchestrator.config.FeatureFlags;
import com.shadowdeploy.orchestrator.engine.EngineException;
import com.shadowdeploy.orchestrator.engine.EngineException.Kind;
import com.shadowdeploy.orchestrator.engine.EngineResult;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Request/response bridge to one transformation engine's executable.
 *
 * Each call spawns the configured executable with the JSON request as its
 * last argument and reads a single JSON reply from its stdout:
 * <pre>
 *   request:  {"command", "args", "options", "project_path"}
 *   reply:    {"success", "stdout", "stderr", "returncode"}
 * </pre>
 * All process handling (spawn, timeout, stop, kill) lives here so callers
 * only ever see an {@link EngineResult} or an {@link EngineException}.
 *
 * Every call is timed and counted:
 * <pre>
 *   shadowdeploy.engine.calls{engine, command, status="success|failure|timeout|..."}
 *   shadowdeploy.engine.duration{engine, command}
 * </pre>
 */
public class SubprocessBridge {

    private static final Logger log = LoggerFactory.getLogger(SubprocessBridge.class);

    private static final int MAX_LOGGED_REPLY = 500;

    // stdout and stderr are drained concurrently so a chatty engine cannot
    // block on a full pipe while we wait for it to exit.
    private static final ExecutorService STREAM_READERS = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "bridge-stream-reader");
        t.setDaemon(true);
        return t;
    });

    private final String               engine;
    private final List<String>         executable;
    private final BridgeSettings       settings;
    private final FeatureFlags         featureFlags;
    private final ObjectMapper         json;
    private final MeterRegistry        meterRegistry;
    private final DataOperationAuditor auditor;

    public SubprocessBridge(String engine,
                            List<String> executable,
                            BridgeSettings settings,
                            FeatureFlags featureFlags,
                            ObjectMapper objectMapper,
                            MeterRegistry meterRegistry,
                            DataOperationAuditor auditor) {
        if (executable == null || executable.isEmpty()) {
            throw new IllegalArgumentException("No bridge executable configured for engine '" + engine + "'");
        }
        this.engine        = engine;
        this.executable    = List.copyOf(executable);
        this.settings      = settings;
        this.featureFlags  = featureFlags;
        this.json          = objectMapper;
        this.meterRegistry = meterRegistry;
        this.auditor       = auditor;
    }

    public String engine() {
        return engine;
    }

    public BridgeSettings settings() {
        return settings;
    }

    // ------------------------------------------------------------------
    // Calls
    // ------------------------------------------------------------------

    public EngineResult call(String command) {
        return call(command, List.of(), Map.of());
    }

    /**
     * Run one engine command.
     *
     * @return the engine's reply; {@code success=false} is a normal outcome
     * @throws EngineException if the engine is disabled, cannot be spawned,
     *                         times out, or does not answer with a JSON envelope
     */
    public EngineResult call(String command, List<String> args, Map<String, Object> options) {
        if (!featureFlags.isEngineEnabled(engine)) {
            throw new EngineException(Kind.DISABLED, engine, command,
                    "transformations are not enabled. Enable feature flag: " + FeatureFlags.engineFlag(engine));
        }

        auditor.record("engine_command", Map.of(
                "engine",  engine,
                "command", command,
                "user",    System.getProperty("user.name", "unknown")));

        String request = toJson(command, new BridgeRequest(command, args, options, settings.projectPath().toString()));

        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "success";
        try {
            EngineResult result = execute(command, request);
            if (!result.success()) {
                status = "failure";
                log.warn("{} {} reported failure: {}", engine, command, result.failureReason());
            } else {
                log.debug("{} {} succeeded", engine, command);
            }
            return result;
        } catch (EngineException e) {
            status = e.getKind().name().toLowerCase();
            throw e;
        } finally {
            sample.stop(meterRegistry.timer("shadowdeploy.engine.duration",
                    "engine", engine, "command", command));
            meterRegistry.counter("shadowdeploy.engine.calls",
                    "engine", engine, "command", command, "status", status).increment();
        }
    }

    // ------------------------------------------------------------------
    // Process handling
    // ------------------------------------------------------------------

    private EngineResult execute(String command, String requestJson) {
        List<String> argv = new ArrayList<>(executable);
        argv.add(requestJson);

        ProcessBuilder builder = new ProcessBuilder(argv);
        builder.environment().put("SHADOWDEPLOY_PROJECT_PATH", settings.projectPath().toString());

        Process process;
        try {
            process = builder.start();
            process.getOutputStream().close();
        } catch (IOException e) {
            log.error("{} bridge could not be started: {}", engine, e.getMessage());
            throw new EngineException(Kind.SPAWN_FAILED, engine, command,
                    "failed to start " + executable.get(0) + ": " + e.getMessage(), e);
        }

        CompletableFuture<String> stdout = drain(process.getInputStream());
        CompletableFuture<String> stderr = drain(process.getErrorStream());

        boolean exited;
        try {
            exited = process.waitFor(settings.timeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            terminate(process);
            throw new EngineException(Kind.SPAWN_FAILED, engine, command, "interrupted while waiting for the engine", e);
        }

        if (!exited) {
            log.warn("{} {} exceeded {} ms; stopping process", engine, command, settings.timeout().toMillis());
            terminate(process);
            throw new EngineException(Kind.TIMEOUT, engine, command,
                    "timed out after " + settings.timeout().toMillis() + "ms");
        }

        return parseReply(command, process.exitValue(), collect(stdout), collect(stderr));
    }

    /** Graceful stop first; forced kill if the process outlives the grace window. */
    private void terminate(Process process) {
        process.destroy();
        try {
            if (!process.waitFor(settings.killGrace().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("{} bridge ignored the stop signal; killing pid {}", engine, process.pid());
                process.destroyForcibly();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
        }
    }

    private EngineResult parseReply(String command, int exitCode, String stdout, String stderr) {
        String reply = stdout.strip();
        if (reply.isEmpty()) {
            if (exitCode != 0) {
                throw new EngineException(Kind.NON_ZERO_EXIT, engine, command,
                        "exited with code " + exitCode + ": " + stderr.strip());
            }
            throw new EngineException(Kind.PROTOCOL_ERROR, engine, command, "no reply on stdout");
        }
        if (!reply.startsWith("{")) {
            throw unparseable(command, exitCode, reply, stderr, null);
        }
        try {
            return json.readValue(reply, EngineResult.class);
        } catch (JsonProcessingException e) {
            throw unparseable(command, exitCode, reply, stderr, e);
        }
    }

    private EngineException unparseable(String command, int exitCode, String reply, String stderr, Throwable cause) {
        if (exitCode != 0) {
            return new EngineException(Kind.NON_ZERO_EXIT, engine, command,
                    "exited with code " + exitCode + ": " + (stderr.isBlank() ? abbreviate(reply) : stderr.strip()), cause);
        }
        return new EngineException(Kind.PROTOCOL_ERROR, engine, command,
                "reply is not a JSON envelope: " + abbreviate(reply), cause);
    }

    private CompletableFuture<String> drain(InputStream in) {
        return CompletableFuture.supplyAsync(() -> {
            try (in) {
                return new String(in.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                log.debug("{} bridge stream closed early: {}", engine, e.getMessage());
                return "";
            }
        }, STREAM_READERS);
    }

    private String collect(CompletableFuture<String> stream) {
        try {
            return stream.get(settings.killGrace().toMillis() + 1_000, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return "";
        } catch (ExecutionException | TimeoutException e) {
            log.warn("{} bridge output could not be collected: {}", engine, e.toString());
            return "";
        }
    }

    private String toJson(String command, BridgeRequest request) {
        try {
            return json.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new EngineException(Kind.PROTOCOL_ERROR, engine, command, "request serialization failed", e);
        }
    }

    private static String abbreviate(String text) {
        return text.length() <= MAX_LOGGED_REPLY ? text : text.substring(0, MAX_LOGGED_REPLY) + "...";
    }
}
