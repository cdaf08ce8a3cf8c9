package org.socionics.ipdb;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Strictly increasing millisecond timestamps.
 *
 * <p>Two calls never return the same instant within a process, even in the
 * same wall-clock millisecond or if the wall clock steps back.</p>
 */
final class MonotonicClock {

    private final Clock clock;
    private final AtomicLong last = new AtomicLong(Long.MIN_VALUE);

    MonotonicClock(Clock clock) {
        this.clock = clock;
    }

    Instant next() {
        long now = clock.millis();
        return Instant.ofEpochMilli(last.updateAndGet(prev -> Math.max(prev + 1, now)));
    }
}
