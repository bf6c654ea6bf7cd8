package com.questrail.crossval.time;

/**
 * Production {@link MonotonicClock} backed by {@link System#nanoTime()}.
 *
 * <p>Not affected by wall-clock adjustments, so a participant blocked on a
 * sync point across an NTP step still gives up after the configured timeout.</p>
 */
public enum SystemMonotonicClock implements MonotonicClock {
    INSTANCE;

    @Override
    public long nowNanos() {
        return System.nanoTime();
    }
}
