package com.questrail.devicelink.internal.time;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Test clock that only moves when a test moves it.
 *
 * <p>Safe to read from lane threads while the test thread advances it.</p>
 */
public final class ManualMonotonicClock implements MonotonicClock {

    private final AtomicLong ticks = new AtomicLong();

    @Override
    public long nowNanos() {
        return ticks.get();
    }

    public void advance(Duration step) {
        if (step.isNegative()) {
            throw new IllegalArgumentException("Monotonic time cannot go backwards: " + step);
        }
        ticks.addAndGet(step.toNanos());
    }

    public void advanceMillis(long millis) {
        advance(Duration.ofMillis(millis));
    }
}
