package com.shadowdeploy.orchestrator.cost;

import java.time.Instant;
import java.util.List;

/**
 * Append-only store of execution records.
 *
 * Implementations throw {@link java.io.UncheckedIOException} when the
 * backing store cannot be read or written; callers let it propagate.
 */
public interface CostLedger {

    /** Appends one record and returns the ledger as persisted. */
    LedgerDocument append(ExecutionRecord record);

    /** Full ledger; an empty document when nothing has been recorded yet. */
    LedgerDocument load();

    /** Records with {@code timestamp >= cutoff}. */
    default List<ExecutionRecord> executionsSince(Instant cutoff) {
        return load().executions().stream()
                .filter(e -> e.timestamp() != null && !e.timestamp().isBefore(cutoff))
                .toList();
    }

    /** Drops every record. */
    void clear();
}
