package com.questrail.crossval.coordinator;

/**
 * Lifecycle phase of a {@link ValidationCoordinator}.
 *
 * <pre>
 *   CREATED → LISTENING → REGISTERING → STEADY_STATE
 *                  │            │              │
 *                  └────────────┴──────────────┴──→ ABORTED | SHUT_DOWN
 *                               └──→ FAILED
 * </pre>
 */
public enum CoordinatorPhase
{
    /** Constructed, not yet bound. */
    CREATED,
    /** Bound, no participant has connected yet. */
    LISTENING,
    /** At least one connection; waiting for every instance to register. */
    REGISTERING,
    /** Every instance registered. */
    STEADY_STATE,
    /** A mismatch was detected; traffic is ignored while the process aborts. */
    ABORTED,
    /** Stopped by {@code shutdown()}. */
    SHUT_DOWN,
    /** A registered participant was lost before registration completed. */
    FAILED;

    public boolean isTerminal() {
        return this == ABORTED || this == SHUT_DOWN || this == FAILED;
    }
}
