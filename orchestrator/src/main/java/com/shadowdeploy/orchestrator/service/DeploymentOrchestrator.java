package com.shadowdeploy.orchestrator.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shadowdeploy.orchestrator.audit.DataOperationAuditor;
import com.shadowdeploy.orchestrator.cost.CostTracker;
import com.shadowdeploy.orchestrator.cost.ExecutionData;
import com.shadowdeploy.orchestrator.engine.EngineException;
import com.shadowdeploy.orchestrator.engine.EngineFactory;
import com.shadowdeploy.orchestrator.engine.EngineResult;
import com.shadowdeploy.orchestrator.engine.EngineSelection;
import com.shadowdeploy.orchestrator.engine.TransformationEngine;
import com.shadowdeploy.orchestrator.model.Deployment;
import com.shadowdeploy.orchestrator.model.DeploymentStatus;
import com.shadowdeploy.orchestrator.model.DeploymentStep;
import com.shadowdeploy.orchestrator.model.StepName;
import com.shadowdeploy.orchestrator.repository.DeploymentRepository;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Blue-green deployment state machine.
 *
 * <pre>
 *   pre_validation → create_shadow → shadow_validation → safety_checks
 *                  → atomic_swap → post_validation
 * </pre>
 *
 * Steps run strictly in order on the calling thread. The first failing step
 * stops the run; a {@code rollback} step is then appended and the deployment
 * ends {@code failed}. The engine's migrate is atomic, so rollback only
 * records and audits the recovery; it never re-runs migrate.
 *
 * A deployment is written to the history store once, at its terminal
 * status. Completed deployments are then charged to the cost ledger.
 */
@Service
public class DeploymentOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(DeploymentOrchestrator.class);

    static final int MAX_HISTORY = 100;

    private final EngineFactory           engineFactory;
    private final DeploymentRepository    repository;
    private final CostTracker             costTracker;
    private final BreakingChangeDetector  detector;
    private final EnvironmentLockRegistry locks;
    private final DataOperationAuditor    auditor;
    private final ObjectMapper            objectMapper;
    private final MeterRegistry           meterRegistry;
    private final Clock                   clock;

    public DeploymentOrchestrator(EngineFactory engineFactory,
                                  DeploymentRepository repository,
                                  CostTracker costTracker,
                                  BreakingChangeDetector detector,
                                  EnvironmentLockRegistry locks,
                                  DataOperationAuditor auditor,
                                  ObjectMapper objectMapper,
                                  MeterRegistry meterRegistry,
                                  Clock clock) {
        this.engineFactory = engineFactory;
        this.repository    = repository;
        this.costTracker   = costTracker;
        this.detector      = detector;
        this.locks         = locks;
        this.auditor       = auditor;
        this.objectMapper  = objectMapper;
        this.meterRegistry = meterRegistry;
        this.clock         = clock;
    }

    // ------------------------------------------------------------------
    // Deploy
    // ------------------------------------------------------------------

    /**
     * Run one deployment to completion.
     *
     * @return the terminal deployment, {@code completed} or {@code failed}
     * @throws com.shadowdeploy.orchestrator.engine.EngineSelectionException if no engine can be
     *         selected; no deployment is created
     * @throws DeploymentInProgressException if the environment is already being deployed
     * @throws java.io.UncheckedIOException  if the cost ledger cannot be written
     */
    public Deployment deploy(String environment, EngineSelection selection) {
        requireEnvironment(environment);
        return deploy(environment, engineFactory.create(selection));
    }

    /**
     * Run one deployment with an engine already handed out by the
     * {@link EngineFactory}; selection and installation checks are not repeated.
     *
     * @throws DeploymentInProgressException if the environment is already being deployed
     */
    public Deployment deploy(String environment, TransformationEngine engine) {
        requireEnvironment(environment);
        if (!locks.tryAcquire(environment)) {
            throw new DeploymentInProgressException(environment);
        }
        try {
            return run(environment, engine);
        } finally {
            locks.release(environment);
        }
    }

    private Deployment run(String environment, TransformationEngine engine) {
        Deployment deployment = new Deployment(environment, engine.name(), clock.instant());
        log.info("Starting blue-green deployment {} to '{}' via {}", deployment.getId(), environment, engine.name());

        try {
            runStep(deployment, StepName.PRE_VALIDATION,    () -> preValidation(engine, environment));
            runStep(deployment, StepName.CREATE_SHADOW,     () -> createShadow(engine, environment));
            runStep(deployment, StepName.SHADOW_VALIDATION, () -> shadowValidation(engine));
            runStep(deployment, StepName.SAFETY_CHECKS,     () -> safetyChecks(deployment, engine, environment));
            runStep(deployment, StepName.ATOMIC_SWAP,       () -> atomicSwap(deployment, engine, environment));
            runStep(deployment, StepName.POST_VALIDATION,   () -> postValidation(engine));

            deployment.markCompleted(clock.instant());
            log.info("Deployment {} completed in {} ms", deployment.getId(), deployment.getDurationMs());
            auditor.record("blue_green_deployment", Map.of(
                    "deploymentId", deployment.getId(),
                    "environment",  environment,
                    "engine",       engine.name(),
                    "status",       "success",
                    "durationMs",   deployment.getDurationMs()));
        } catch (StepFailure e) {
            log.error("Deployment {} failed: {}", deployment.getId(), e.getMessage());
            deployment.markFailed(e.getMessage(), clock.instant());
            rollback(deployment);
        }

        Deployment saved = repository.save(deployment);
        meterRegistry.counter("shadowdeploy.deployments",
                "environment", environment, "status", saved.getStatus().wireName()).increment();

        if (saved.getStatus() == DeploymentStatus.COMPLETED) {
            trackDeploymentCost(saved);
        }
        return saved;
    }

    // ------------------------------------------------------------------
    // History
    // ------------------------------------------------------------------

    public Optional<Deployment> findById(String id) {
        return repository.findById(id);
    }

    /** Most recent {@code limit} deployments, newest first. */
    public List<Deployment> history(int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be at least 1, got " + limit);
        }
        return repository.findAllByOrderByStartedAtDesc(PageRequest.of(0, Math.min(limit, MAX_HISTORY)));
    }

    // ------------------------------------------------------------------
    // Steps
    // ------------------------------------------------------------------

    private Map<String, Object> preValidation(TransformationEngine engine, String environment) {
        EngineResult status = engine.getStatus();
        EngineResult audit  = engine.audit(null);
        EngineResult test   = engine.test(null);
        EngineResult diff   = engine.diff(environment);

        Map<String, Boolean> validations = new LinkedHashMap<>();
        validations.put("environment_ready",   status.success());
        validations.put("models_valid",        audit.success());
        validations.put("tests_passing",       test.success());
        validations.put("no_breaking_changes", diff.success() && !detector.hasBreakingChanges(diff.stdoutOrEmpty()));

        Map<String, Object> result = new LinkedHashMap<>(validations);
        result.put("data_loss_detected", reportDataLoss(environment, StepName.PRE_VALIDATION, diff));

        if (validations.containsValue(false)) {
            result.put("status", raw(status));
            result.put("audit",  raw(audit));
            result.put("test",   raw(test));
            result.put("diff",   raw(diff));
            throw new StepFailure("Pre-deployment validation failed: " + toJson(validations), result);
        }
        return result;
    }

    private Map<String, Object> createShadow(TransformationEngine engine, String environment) {
        boolean isProd = "prod".equals(environment);
        EngineResult plan = engine.plan(environment, isProd);
        if (!plan.success()) {
            throw new StepFailure("Failed to create shadow environment: " + plan.failureReason(), raw(plan));
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("shadowCreated", true);
        result.put("isProd",        isProd);
        result.put("planOutput",    plan.stdoutOrEmpty());
        engine.parseCostHint(plan.stdoutOrEmpty()).ifPresent(hint -> result.put("costHint", hint));
        return result;
    }

    private Map<String, Object> shadowValidation(TransformationEngine engine) {
        EngineResult audit = engine.audit(null);
        EngineResult test  = engine.test(null);

        Map<String, Boolean> checks = new LinkedHashMap<>();
        checks.put("audits_pass", audit.success());
        checks.put("tests_pass",  test.success());

        Map<String, Object> result = new LinkedHashMap<>(checks);
        if (checks.containsValue(false)) {
            result.put("audit", raw(audit));
            result.put("test",  raw(test));
            throw new StepFailure("Shadow environment validation failed: " + toJson(checks), result);
        }
        return result;
    }

    /** Re-runs the diff; a breaking change here means one appeared after pre-validation. */
    private Map<String, Object> safetyChecks(Deployment deployment, TransformationEngine engine, String environment) {
        EngineResult diff = engine.diff(environment);

        Map<String, Boolean> checks = new LinkedHashMap<>();
        checks.put("diff_available",          diff.success());
        checks.put("no_new_breaking_changes", !detector.hasBreakingChanges(diff.stdoutOrEmpty()));

        Map<String, Object> result = new LinkedHashMap<>(checks);
        result.put("data_loss_detected", reportDataLoss(environment, StepName.SAFETY_CHECKS, diff));

        if (checks.containsValue(false)) {
            result.put("diff", raw(diff));
            log.warn("Deployment {}: destructive diff appeared after pre-validation", deployment.getId());
            throw new StepFailure("Safety checks failed: " + toJson(checks), result);
        }
        return result;
    }

    private Map<String, Object> atomicSwap(Deployment deployment, TransformationEngine engine, String environment) {
        log.info("Performing atomic environment swap for {}", environment);
        auditor.record("atomic_swap", Map.of(
                "deploymentId", deployment.getId(),
                "environment",  environment,
                "engine",       engine.name()));

        EngineResult migrate = engine.migrate(environment);
        if (!migrate.success()) {
            throw new StepFailure("Atomic swap failed: " + migrate.failureReason(), raw(migrate));
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("swapCompleted",  true);
        result.put("migrateOutput",  migrate.stdoutOrEmpty());
        result.put("timestamp",      clock.instant().toString());
        return result;
    }

    private Map<String, Object> postValidation(TransformationEngine engine) {
        EngineResult status = engine.getStatus();
        if (!status.success()) {
            throw new StepFailure("Post-deployment validation failed: " + status.failureReason(), raw(status));
        }
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("environment_stable", true);
        result.put("statusOutput",       status.stdoutOrEmpty());
        return result;
    }

    // ------------------------------------------------------------------
    // Rollback
    // ------------------------------------------------------------------

    /** Never throws: a rollback error is kept on the deployment next to the original error. */
    private void rollback(Deployment deployment) {
        log.warn("Rolling back deployment {}", deployment.getId());
        DeploymentStep step = deployment.startStep(StepName.ROLLBACK, clock.instant());
        try {
            auditor.record("deployment_rollback", Map.of(
                    "deploymentId", deployment.getId(),
                    "environment",  deployment.getEnvironment(),
                    "reason",       deployment.getError()));

            Map<String, Object> result = new LinkedHashMap<>();
            result.put("previousStateRetained", true);
            result.put("reason",                deployment.getError());
            step.complete(toJson(result), clock.instant());
            log.info("Rollback of {} completed", deployment.getId());
        } catch (RuntimeException e) {
            log.error("Rollback of {} failed: {}", deployment.getId(), e.getMessage(), e);
            step.fail(e.getMessage(), clock.instant());
            deployment.setRollbackError(e.getMessage());
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    @FunctionalInterface
    private interface StepAction {
        Map<String, Object> run();
    }

    private void runStep(Deployment deployment, StepName name, StepAction action) {
        DeploymentStep step = deployment.startStep(name, clock.instant());
        log.info("Deployment {}: executing step {}", deployment.getId(), name.wireName());
        try {
            Map<String, Object> result = action.run();
            step.complete(toJson(result), clock.instant());
            log.debug("Step {} completed in {} ms", name.wireName(), step.getDurationMs());
        } catch (StepFailure e) {
            step.fail(e.getMessage(), toJson(e.details), clock.instant());
            log.error("Step {} failed: {}", name.wireName(), e.getMessage());
            throw e;
        } catch (EngineException e) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("kind",    e.getKind().name());
            details.put("engine",  e.getEngine());
            details.put("command", e.getCommand());
            step.fail(e.getMessage(), toJson(details), clock.instant());
            log.error("Step {} failed: {}", name.wireName(), e.getMessage());
            throw new StepFailure(e.getMessage(), details);
        } catch (RuntimeException e) {
            String reason = "Unexpected error in " + name.wireName() + ": " + e;
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("exception", e.getClass().getName());
            details.put("message",   e.getMessage());
            step.fail(reason, toJson(details), clock.instant());
            log.error("Step {} failed unexpectedly", name.wireName(), e);
            throw new StepFailure(reason, details);
        }
    }

    private static void requireEnvironment(String environment) {
        if (environment == null || environment.isBlank()) {
            throw new IllegalArgumentException("environment must not be blank");
        }
    }

    private boolean reportDataLoss(String environment, StepName step, EngineResult diff) {
        boolean dataLoss = detector.detectDataLoss(diff.stdoutOrEmpty());
        if (dataLoss) {
            log.warn("Potential data loss in diff for '{}' ({})", environment, step.wireName());
            auditor.record("potential_data_loss", Map.of(
                    "environment", environment,
                    "step",        step.wireName()));
        }
        return dataLoss;
    }

    private void trackDeploymentCost(Deployment deployment) {
        double hours = deployment.getDurationMs() / 1000.0 / 3600.0;
        costTracker.trackExecution(deployment.getEnvironment(),
                new ExecutionData(hours, 0, deployment.getSteps().size()));
    }

    private static Map<String, Object> raw(EngineResult result) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("success",    result.success());
        out.put("returncode", result.returncode());
        out.put("stdout",     result.stdout());
        out.put("stderr",     result.stderr());
        if (result.error() != null) {
            out.put("error", result.error());
        }
        return out;
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Step result is not serializable", e);
        }
    }

    /** Stops the step sequence; carries what the step captured before failing. */
    private static final class StepFailure extends RuntimeException {
        private final Map<String, Object> details;

        StepFailure(String message, Map<String, Object> details) {
            super(message);
            this.details = details;
        }
    }
}
