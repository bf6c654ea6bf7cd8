package com.questrail.crossval.time;

import java.time.Duration;
import java.util.Objects;

/**
 * Deadline
 * =============================================================================
 * A single bounded-deadline wait primitive.
 *
 * <p>A participant waiting for a validation result does not count elapsed
 * poll slices; it asks the deadline how much time is left. Slices that end
 * early (a spurious wakeup, an interrupted select, a stale result) therefore
 * never shorten or stretch the total wait.</p>
 *
 * <pre>
 *   Deadline d = Deadline.after(timeout, clock);
 *   while (!d.hasExpired()) {
 *       waitAtMost(d.nextSlice(pollSlice));
 *       ...
 *   }
 * </pre>
 */
public final class Deadline
{
    private final MonotonicClock clock;
    private final long deadlineNanos;

    private Deadline(MonotonicClock clock, long deadlineNanos) {
        this.clock = clock;
        this.deadlineNanos = deadlineNanos;
    }

    /**
     * Creates a deadline {@code timeout} from now.
     *
     * @param timeout non-negative wait budget
     * @param clock   monotonic clock used for all later queries
     */
    public static Deadline after(Duration timeout, MonotonicClock clock) {
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(clock, "clock");
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be >= 0");
        }
        return new Deadline(clock, clock.nowNanos() + timeout.toNanos());
    }

    public boolean hasExpired() {
        return remainingNanos() <= 0;
    }

    public long remainingNanos() {
        return deadlineNanos - clock.nowNanos();
    }

    /**
     * Returns the length of the next wait slice: {@code slice}, clipped to the
     * time remaining. Never negative.
     */
    public Duration nextSlice(Duration slice) {
        Objects.requireNonNull(slice, "slice");
        long remaining = Math.max(0L, remainingNanos());
        return Duration.ofNanos(Math.min(slice.toNanos(), remaining));
    }
}
