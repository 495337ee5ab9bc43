package com.shadowdeploy.orchestrator.cost;

import java.time.Instant;

/** Aggregates of all executions inside one reporting period. */
public record SavingsReport(
        ReportingPeriod period,
        double  physicalComputeHours,
        double  virtualComputeHours,
        double  actualCost,
        double  savedCost,
        double  potentialCost,
        double  savingsPercentage,
        String  currency,
        Instant calculatedAt
) {}
