package com.questrail.crossval.barrier;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * BarrierRound
 * -----------------------------------------------------------------------------
 * Immutable snapshot of the single live barrier round.
 *
 * <p>A round collects one {@link Arrival} per participant for a single sync
 * point. The <em>idle</em> round has sync point {@value #IDLE_SYNC_POINT} and no
 * arrivals; it is the state between rounds.</p>
 *
 * <p>Arrival order is preserved. The first arrival is the reference every
 * later one is compared against.</p>
 *
 * @param syncPoint sync point sequence this round collects, or {@value #IDLE_SYNC_POINT}
 * @param expected  number of arrivals that resolves the round
 * @param arrivals  reports received so far, in arrival order
 */
public record BarrierRound(int syncPoint, int expected, List<Arrival> arrivals) {

    public static final int IDLE_SYNC_POINT = -1;

    public BarrierRound {
        Objects.requireNonNull(arrivals, "arrivals");
        if (expected < 1) {
            throw new IllegalArgumentException("expected must be >= 1");
        }
        if (arrivals.size() > expected) {
            throw new IllegalArgumentException(
                    "round holds " + arrivals.size() + " arrivals but expects " + expected);
        }
        arrivals = Collections.unmodifiableList(new ArrayList<>(arrivals));
    }

    public static BarrierRound idle(int expected) {
        return new BarrierRound(IDLE_SYNC_POINT, expected, List.of());
    }

    public static BarrierRound open(int syncPoint, int expected) {
        return new BarrierRound(syncPoint, expected, List.of());
    }

    public boolean isIdle() {
        return syncPoint == IDLE_SYNC_POINT;
    }

    public boolean isComplete() {
        return arrivals.size() == expected;
    }

    public BarrierRound withArrival(Arrival arrival) {
        List<Arrival> next = new ArrayList<>(arrivals);
        next.add(Objects.requireNonNull(arrival, "arrival"));
        return new BarrierRound(syncPoint, expected, next);
    }

    public boolean hasArrivalFrom(int instanceId) {
        for (Arrival a : arrivals) {
            if (a.instanceId() == instanceId) {
                return true;
            }
        }
        return false;
    }
}
