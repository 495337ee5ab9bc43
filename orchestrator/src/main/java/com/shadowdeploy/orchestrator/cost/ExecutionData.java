package com.shadowdeploy.orchestrator.cost;

/**
 * Measurements of one run, as reported by the caller.
 *
 * @param computeHours    wall-clock compute of the run
 * @param dataSizeGB      data volume touched, 0 when unknown
 * @param modelsProcessed number of models built or validated
 * @param model           single model name for per-model tracking, else {@code null}
 */
public record ExecutionData(double computeHours, double dataSizeGB, int modelsProcessed, String model) {

    public ExecutionData(double computeHours, double dataSizeGB, int modelsProcessed) {
        this(computeHours, dataSizeGB, modelsProcessed, null);
    }
}
