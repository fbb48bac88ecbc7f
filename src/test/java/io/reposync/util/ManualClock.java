package io.reposync.util;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Clock that only moves when a test advances it.
 */
public final class ManualClock extends Clock {
    private final AtomicLong millis;

    public ManualClock(long startMs) {
        this.millis = new AtomicLong(startMs);
    }

    public void advance(long deltaMs) {
        millis.addAndGet(deltaMs);
    }

    public void set(long nowMs) {
        millis.set(nowMs);
    }

    @Override
    public long millis() {
        return millis.get();
    }

    @Override
    public Instant instant() {
        return Instant.ofEpochMilli(millis.get());
    }

    @Override
    public ZoneId getZone() {
        return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return this;
    }
}
