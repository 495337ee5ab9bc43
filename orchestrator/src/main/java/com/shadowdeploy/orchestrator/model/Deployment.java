package com.shadowdeploy.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

/**
 * One attempt to promote a transformation project into an environment.
 *
 * The record is owned by the orchestrator run that created it and is only
 * written to the history store once it reaches a terminal status.
 *
 * DB table: deployments  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "deployments")
public class Deployment {

    // 36^6: six base-36 characters of random suffix.
    private static final long ID_SUFFIX_RANGE = 2_176_782_336L;

    @Id
    private String id;

    @Column(nullable = false)
    private String environment;

    // Engine identifier the deployment was driven through, e.g. "sqlmesh".
    @Column(nullable = false)
    private String engine;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private DeploymentStatus status = DeploymentStatus.IN_PROGRESS;

    @Column(columnDefinition = "TEXT")
    private String error;

    // Set only when the rollback bookkeeping itself failed; never replaces `error`.
    @Column(name = "rollback_error", columnDefinition = "TEXT")
    private String rollbackError;

    @Column(name = "started_at", nullable = false, updatable = false)
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "failed_at")
    private Instant failedAt;

    @Column(name = "duration_ms")
    private Long durationMs;

    @OneToMany(mappedBy = "deployment", cascade = CascadeType.ALL, fetch = FetchType.EAGER)
    @OrderBy("position ASC")
    private List<DeploymentStep> steps = new ArrayList<>();

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Deployment() {}   // required by JPA

    public Deployment(String environment, String engine, Instant startedAt) {
        this.id          = generateId(startedAt);
        this.environment = environment;
        this.engine      = engine;
        this.startedAt   = startedAt;
    }

    /**
     * Time-based id with a random suffix, e.g. {@code deploy-1760900000000-k3x9qa}.
     */
    public static String generateId(Instant now) {
        String suffix = Long.toString(ThreadLocalRandom.current().nextLong(ID_SUFFIX_RANGE), 36);
        return "deploy-" + now.toEpochMilli() + "-" + "0".repeat(6 - suffix.length()) + suffix;
    }

    // ------------------------------------------------------------------
    // Step bookkeeping
    // ------------------------------------------------------------------

    /** Append a RUNNING step; steps are never reordered or removed. */
    public DeploymentStep startStep(StepName name, Instant at) {
        DeploymentStep step = new DeploymentStep(this, name, steps.size(), at);
        steps.add(step);
        return step;
    }

    public Optional<DeploymentStep> findStep(StepName name) {
        return steps.stream().filter(s -> s.getName() == name).findFirst();
    }

    public void markCompleted(Instant at) {
        this.status      = DeploymentStatus.COMPLETED;
        this.completedAt = at;
        this.durationMs  = at.toEpochMilli() - startedAt.toEpochMilli();
    }

    public void markFailed(String error, Instant at) {
        this.status     = DeploymentStatus.FAILED;
        this.error      = error;
        this.failedAt   = at;
        this.durationMs = at.toEpochMilli() - startedAt.toEpochMilli();
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public String               getId()            { return id; }
    public String               getEnvironment()   { return environment; }
    public String               getEngine()        { return engine; }
    public DeploymentStatus     getStatus()        { return status; }
    public String               getError()         { return error; }
    public String               getRollbackError() { return rollbackError; }
    public Instant              getStartedAt()     { return startedAt; }
    public Instant              getCompletedAt()   { return completedAt; }
    public Instant              getFailedAt()      { return failedAt; }
    public Long                 getDurationMs()    { return durationMs; }
    public List<DeploymentStep> getSteps()         { return steps; }

    public void setRollbackError(String rollbackError) { this.rollbackError = rollbackError; }
}
