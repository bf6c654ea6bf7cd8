package com.questrail.crossval.observability;

import com.questrail.crossval.coordinator.CoordinatorPhase;

import java.time.Instant;

/**
 * Record representing a coordinator phase change.
 */
public record PhaseTransitionEvent(
    Instant timestamp,
    CoordinatorPhase from,
    CoordinatorPhase to
) {
}
