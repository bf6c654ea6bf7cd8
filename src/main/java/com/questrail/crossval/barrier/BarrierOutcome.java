package com.questrail.crossval.barrier;

import java.util.List;
import java.util.Objects;

/**
 * Result of feeding one report into a barrier round.
 *
 * <p>{@link Pending} means the round is still filling. {@link Match} and
 * {@link Mismatch} are terminal: they carry the resolved arrivals so the
 * caller knows exactly which participants must receive a result.</p>
 */
public sealed interface BarrierOutcome
        permits BarrierOutcome.Pending, BarrierOutcome.Match, BarrierOutcome.Mismatch
{
    default boolean isResolved() {
        return !(this instanceof Pending);
    }

    record Pending() implements BarrierOutcome {
        static final Pending INSTANCE = new Pending();
    }

    /**
     * Every arrival agreed with the reference.
     */
    record Match(int syncPoint, List<Arrival> arrivals) implements BarrierOutcome {
        public Match {
            arrivals = List.copyOf(Objects.requireNonNull(arrivals, "arrivals"));
        }
    }

    /**
     * At least one arrival disagreed with the reference.
     *
     * @param divergentIndex index into {@code arrivals} of the first disagreeing arrival
     * @param detail         human-readable description naming both fingerprints
     */
    record Mismatch(int syncPoint, List<Arrival> arrivals, int divergentIndex, String detail)
            implements BarrierOutcome {
        public Mismatch {
            arrivals = List.copyOf(Objects.requireNonNull(arrivals, "arrivals"));
            Objects.requireNonNull(detail, "detail");
        }
    }
}
