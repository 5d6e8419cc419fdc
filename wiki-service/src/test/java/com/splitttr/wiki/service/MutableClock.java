package com.splitttr.wiki.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

// Test clock that moves forward by a fixed tick on every read.
class MutableClock extends Clock {

    private Instant now;
    private Duration tick;

    MutableClock(Instant start, Duration tick) {
        this.now = start;
        this.tick = tick;
    }

    void advance(Duration amount) {
        now = now.plus(amount);
    }

    void setTick(Duration tick) {
        this.tick = tick;
    }

    @Override
    public Instant instant() {
        Instant current = now;
        now = now.plus(tick);
        return current;
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
