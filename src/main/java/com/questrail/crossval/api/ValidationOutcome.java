package com.questrail.crossval.api;

/**
 * What a single {@code validate} call observed.
 *
 * <p>Only {@link #DIVERGED} reflects a disagreement between instances, and it
 * is normally never returned: the divergence handler aborts the process
 * first. Every other non-{@link #MATCHED} outcome means "no verdict for this
 * sync point"; the computation continues.</p>
 */
public enum ValidationOutcome
{
    /** Every instance reported an equivalent fingerprint. */
    MATCHED,
    /** The instances disagreed and the divergence handler returned. */
    DIVERGED,
    /** The fingerprint was recorded; the round is still waiting for other instances. */
    RECORDED,
    /** No result arrived within the response timeout. */
    TIMED_OUT,
    /** The connection failed or the peer broke the protocol. */
    FAILED,
    /** The shared segment was busy; this sync point was not checked. */
    SKIPPED,
    /** Validation is not active (not initialised, suspended, or shut down). */
    DISABLED
}
