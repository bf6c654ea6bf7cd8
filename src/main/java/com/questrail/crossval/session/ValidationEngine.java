package com.questrail.crossval.session;

import com.questrail.crossval.api.Fingerprint;
import com.questrail.crossval.api.ValidationOutcome;

/**
 * The transport-specific half of a session. One engine lives for one
 * ACTIVE period: {@code suspend} discards it and {@code resume} builds a new one.
 */
interface ValidationEngine
{
    ValidationOutcome validate(int syncPoint, int pointOrdinal, Fingerprint fingerprint);

    /**
     * @return {@code true} if a divergence was recorded for a caller to act on
     */
    boolean validationFailed();

    String mismatchDetail();

    /**
     * Releases everything immediately, without telling peers.
     */
    void abandon();

    /**
     * Tells peers this instance is leaving, then releases everything.
     */
    void shutdown();
}
