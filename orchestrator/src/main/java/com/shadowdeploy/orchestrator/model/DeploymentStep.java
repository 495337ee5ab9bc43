package com.shadowdeploy.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * One named stage within a Deployment.
 *
 * result_json holds the stage's output (validation flags, plan output,
 * migrate output) serialized by the orchestrator; error holds the message
 * that failed the stage.
 *
 * DB table: deployment_steps  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "deployment_steps")
public class DeploymentStep {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "deployment_id", nullable = false)
    private Deployment deployment;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private StepName name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private StepState state = StepState.RUNNING;

    // Zero-based index in execution order.
    @Column(nullable = false)
    private int position;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    @Column(name = "duration_ms")
    private Long durationMs;

    @Column(name = "result_json", columnDefinition = "TEXT")
    private String resultJson;

    @Column(columnDefinition = "TEXT")
    private String error;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected DeploymentStep() {}   // required by JPA

    DeploymentStep(Deployment deployment, StepName name, int position, Instant startedAt) {
        this.deployment = deployment;
        this.name       = name;
        this.position   = position;
        this.startedAt  = startedAt;
    }

    // ------------------------------------------------------------------
    // Transitions
    // ------------------------------------------------------------------

    public void complete(String resultJson, Instant at) {
        this.state      = StepState.COMPLETED;
        this.resultJson = resultJson;
        finish(at);
    }

    public void fail(String error, Instant at) {
        fail(error, null, at);
    }

    /** Failed with whatever the stage captured before failing (raw engine output). */
    public void fail(String error, String resultJson, Instant at) {
        this.state      = StepState.FAILED;
        this.error      = error;
        this.resultJson = resultJson;
        finish(at);
    }

    private void finish(Instant at) {
        this.finishedAt = at;
        this.durationMs = at.toEpochMilli() - startedAt.toEpochMilli();
    }

    // ------------------------------------------------------------------
    // Getters
    // ------------------------------------------------------------------

    public UUID       getId()         { return id; }
    public Deployment getDeployment() { return deployment; }
    public StepName   getName()       { return name; }
    public StepState  getState()      { return state; }
    public int        getPosition()   { return position; }
    public Instant    getStartedAt()  { return startedAt; }
    public Instant    getFinishedAt() { return finishedAt; }
    public Long       getDurationMs() { return durationMs; }
    public String     getResultJson() { return resultJson; }
    public String     getError()      { return error; }
}
