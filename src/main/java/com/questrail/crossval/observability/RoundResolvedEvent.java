package com.questrail.crossval.observability;

import com.questrail.crossval.barrier.BarrierOutcome;

import java.time.Instant;

/**
 * Record representing a barrier round that reached its expected arrivals.
 *
 * @param outcome either {@link BarrierOutcome.Match} or {@link BarrierOutcome.Mismatch}
 */
public record RoundResolvedEvent(
    Instant timestamp,
    BarrierOutcome outcome
) {
    public boolean passed() {
        return outcome instanceof BarrierOutcome.Match;
    }
}
