package com.workqueue.support;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Clock that tests move by hand. Always UTC.
 */
public class MutableClock extends Clock {
    private volatile Instant instant;

    public MutableClock(LocalDateTime start) {
        this.instant = start.toInstant(ZoneOffset.UTC);
    }

    public void advance(Duration duration) {
        instant = instant.plus(duration);
    }

    public LocalDateTime now() {
        return LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    @Override
    public ZoneId getZone() {
        return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        throw new UnsupportedOperationException("MutableClock is always UTC");
    }

    @Override
    public Instant instant() {
        return instant;
    }
}
