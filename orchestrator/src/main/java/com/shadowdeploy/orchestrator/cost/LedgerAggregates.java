package com.shadowdeploy.orchestrator.cost;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

/** Whole-ledger totals, recomputed on every append. */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LedgerAggregates(
        int     totalExecutions,
        double  totalPhysicalHours,
        double  totalVirtualHours,
        double  totalCost,
        double  totalSaved,
        Instant lastUpdated
) {
    public static LedgerAggregates empty() {
        return new LedgerAggregates(0, 0, 0, 0, 0, null);
    }

    public static LedgerAggregates of(List<ExecutionRecord> executions, Instant now) {
        double physical = 0, virtual = 0, cost = 0, saved = 0;
        for (ExecutionRecord e : executions) {
            physical += e.physicalComputeHours();
            virtual  += e.virtualComputeHours();
            cost     += e.cost();
            saved    += e.savedCost();
        }
        return new LedgerAggregates(executions.size(), physical, virtual, cost, saved, now);
    }
}
