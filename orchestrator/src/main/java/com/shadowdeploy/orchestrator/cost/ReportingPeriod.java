package com.shadowdeploy.orchestrator.cost;

import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Duration;
import java.util.Locale;

/** Look-back windows for savings aggregation. */
public enum ReportingPeriod {
    DAY(1),
    WEEK(7),
    MONTH(30),
    QUARTER(90);

    private final Duration window;

    ReportingPeriod(int days) {
        this.window = Duration.ofDays(days);
    }

    public Duration window() {
        return window;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Unknown or missing names fall back to {@link #MONTH}. */
    public static ReportingPeriod fromName(String name) {
        if (name == null) {
            return MONTH;
        }
        for (ReportingPeriod period : values()) {
            if (period.wireName().equalsIgnoreCase(name.strip())) {
                return period;
            }
        }
        return MONTH;
    }
}
