package com.questrail.crossval.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for every bounded wait in the validation protocol.
 *
 * <h2>Binding invariant</h2>
 * Response timeouts, poll slices, connect retry spacing and send backoff MUST
 * be computed from a monotonic source. Wall-clock time is never used to decide
 * whether a participant has waited long enough.
 *
 * <p>For deterministic tests, use a manually advanced implementation.</p>
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     *
     * <p>Values are only meaningful for elapsed time computations.</p>
     */
    long nowNanos();
}
