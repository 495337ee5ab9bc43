package com.shadowdeploy.orchestrator.cost;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One ledger entry. Exactly one of the hour fields is non-zero for a
 * non-empty run: virtual environments accrue {@code virtualComputeHours}
 * and {@code savedCost}, all others {@code physicalComputeHours} and
 * {@code cost}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExecutionRecord(
        Instant timestamp,
        String  environment,
        @JsonProperty("isVirtual") boolean isVirtual,
        double  physicalComputeHours,
        double  virtualComputeHours,
        double  dataSizeGB,
        int     modelsProcessed,
        double  cost,
        double  savedCost,
        String  model
) {
    public double totalComputeHours() {
        return physicalComputeHours + virtualComputeHours;
    }
}
