package com.questrail.crossval.config;

import java.time.Duration;
import java.util.Objects;

/**
 * ValidationTimingPolicy
 * -----------------------------------------------------------------------------
 * Operational timing for the validation protocol.
 *
 * <p>Operational only: it never changes what a
 * round means or when it resolves; it only bounds how long callers block and
 * how retries are spaced.</p>
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>responseTimeout</b>: Total time a participant waits for the
 *       {@code ValidationResult} of a sync point before logging a warning and
 *       returning to the simulation.</li>
 *   <li><b>pollSlice</b>: Length of one readiness poll inside that wait.</li>
 *   <li><b>ioBackoff</b>: Pause before retrying a send or a partial receive
 *       that would block.</li>
 *   <li><b>connectRetryDelay</b> / <b>connectAttempts</b>: Spacing and bound
 *       for initial contact with a coordinator (or segment) that may not exist yet.</li>
 *   <li><b>initialContactDelay</b>: Pause before the first connect, giving a
 *       co-located coordinator time to start listening.</li>
 *   <li><b>resumeSettleDelay</b>: Pause on resume after a checkpoint, letting
 *       the peer side recreate its listening endpoint first.</li>
 *   <li><b>abortFlushTimeout</b>: Upper bound the coordinator waits for a
 *       mismatch broadcast to be written before aborting the process.</li>
 * </ul>
 */
public record ValidationTimingPolicy(
        Duration responseTimeout,
        Duration pollSlice,
        Duration ioBackoff,
        Duration connectRetryDelay,
        int connectAttempts,
        Duration initialContactDelay,
        Duration resumeSettleDelay,
        Duration abortFlushTimeout
) {
    public ValidationTimingPolicy {
        requireNonNegative(responseTimeout, "responseTimeout");
        requireNonNegative(pollSlice, "pollSlice");
        requireNonNegative(ioBackoff, "ioBackoff");
        requireNonNegative(connectRetryDelay, "connectRetryDelay");
        requireNonNegative(initialContactDelay, "initialContactDelay");
        requireNonNegative(resumeSettleDelay, "resumeSettleDelay");
        requireNonNegative(abortFlushTimeout, "abortFlushTimeout");

        if (pollSlice.isZero()) {
            throw new IllegalArgumentException("pollSlice must be positive");
        }
        if (connectAttempts < 1) {
            throw new IllegalArgumentException("connectAttempts must be >= 1");
        }
    }

    /**
     * Defaults matching the deployed behavior:
     * <ul>
     *   <li>responseTimeout: 5s</li>
     *   <li>pollSlice: 100ms</li>
     *   <li>ioBackoff: 10ms</li>
     *   <li>connectRetryDelay: 100ms, connectAttempts: 50</li>
     *   <li>initialContactDelay: 200ms</li>
     *   <li>resumeSettleDelay: 500ms</li>
     *   <li>abortFlushTimeout: 1s</li>
     * </ul>
     */
    public static ValidationTimingPolicy defaults() {
        return new ValidationTimingPolicy(
                Duration.ofSeconds(5),
                Duration.ofMillis(100),
                Duration.ofMillis(10),
                Duration.ofMillis(100),
                50,
                Duration.ofMillis(200),
                Duration.ofMillis(500),
                Duration.ofSeconds(1)
        );
    }

    /**
     * Copy of this policy with a different response timeout. Tests use this
     * to keep timeout scenarios short.
     */
    public ValidationTimingPolicy withResponseTimeout(Duration timeout) {
        return new ValidationTimingPolicy(timeout, pollSlice, ioBackoff, connectRetryDelay,
                connectAttempts, initialContactDelay, resumeSettleDelay, abortFlushTimeout);
    }

    /**
     * Copy of this policy with different initial-contact and resume delays.
     */
    public ValidationTimingPolicy withDelays(Duration initialContact, Duration resumeSettle) {
        return new ValidationTimingPolicy(responseTimeout, pollSlice, ioBackoff, connectRetryDelay,
                connectAttempts, initialContact, resumeSettle, abortFlushTimeout);
    }

    private static void requireNonNegative(Duration d, String name) {
        Objects.requireNonNull(d, name);
        if (d.isNegative()) {
            throw new IllegalArgumentException(name + " must be non-negative");
        }
    }
}
