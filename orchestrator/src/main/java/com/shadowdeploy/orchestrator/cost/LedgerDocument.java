package com.shadowdeploy.orchestrator.cost;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * On-disk shape of the cost ledger:
 * {@code {"executions": [...], "aggregates": {...}, "createdAt": "..."}}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LedgerDocument(
        List<ExecutionRecord> executions,
        LedgerAggregates      aggregates,
        Instant               createdAt
) {
    public LedgerDocument {
        executions = executions == null ? List.of() : List.copyOf(executions);
        aggregates = aggregates == null ? LedgerAggregates.empty() : aggregates;
    }

    public static LedgerDocument empty(Instant createdAt) {
        return new LedgerDocument(List.of(), LedgerAggregates.empty(), createdAt);
    }

    /** Copy with one more execution and refreshed aggregates. */
    public LedgerDocument append(ExecutionRecord record, Instant now) {
        List<ExecutionRecord> all = new ArrayList<>(executions);
        all.add(record);
        return new LedgerDocument(all, LedgerAggregates.of(all, now), createdAt);
    }
}
