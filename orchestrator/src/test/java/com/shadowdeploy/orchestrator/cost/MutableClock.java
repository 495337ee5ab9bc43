package com.shadowdeploy.orchestrator.cost;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/** Test clock that only moves when told to. */
final class MutableClock extends Clock {

    private Instant now;

    MutableClock(Instant start) {
        this.now = start;
    }

    void set(Instant instant)          { this.now = instant; }
    void advance(Duration duration)    { this.now = now.plus(duration); }

    @Override public ZoneId  getZone()             { return ZoneOffset.UTC; }
    @Override public Clock   withZone(ZoneId zone) { return this; }
    @Override public Instant instant()             { return now; }
}
