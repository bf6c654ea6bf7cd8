package com.questrail.crossval.failfast;

import java.util.Objects;

/**
 * Describes a detected divergence between instances.
 *
 * @param origin    which side of the protocol observed it
 * @param syncPoint sync point sequence at which the fingerprints disagreed
 * @param detail    human-readable description, including fingerprints where known
 */
public record DivergenceReport(Origin origin, int syncPoint, String detail) {

    public enum Origin {
        /** The coordinator compared the round and found a disagreement. */
        COORDINATOR,
        /** A participant received a failed validation result. */
        PARTICIPANT,
        /** The shared-memory segment carries the failed flag. */
        SHARED_MEMORY
    }

    public DivergenceReport {
        Objects.requireNonNull(origin, "origin");
        Objects.requireNonNull(detail, "detail");
    }
}
