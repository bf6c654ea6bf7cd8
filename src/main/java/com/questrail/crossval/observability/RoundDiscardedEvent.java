package com.questrail.crossval.observability;

import com.questrail.crossval.barrier.Arrival;

import java.time.Instant;
import java.util.List;

/**
 * Record representing a partial round dropped by a report for a newer sync point.
 */
public record RoundDiscardedEvent(
    Instant timestamp,
    int discardedSyncPoint,
    int newSyncPoint,
    List<Arrival> discarded
) {
    public RoundDiscardedEvent {
        discarded = List.copyOf(discarded);
    }
}
