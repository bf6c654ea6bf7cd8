package com.questrail.crossval.barrier;

import com.questrail.crossval.api.Fingerprint;

import java.util.Objects;

/**
 * One participant's report within a barrier round.
 */
public record Arrival(int instanceId, Fingerprint fingerprint) {

    public Arrival {
        Objects.requireNonNull(fingerprint, "fingerprint");
    }
}
