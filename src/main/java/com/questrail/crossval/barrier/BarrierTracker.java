package com.questrail.crossval.barrier;

import com.questrail.crossval.compare.ComparisonResult;
import com.questrail.crossval.compare.FingerprintComparator;

import java.util.List;
import java.util.Objects;

/**
 * BarrierTracker
 * -----------------------------------------------------------------------------
 * Pure, deterministic transition function for the single live barrier round.
 *
 * <h2>Role in the architecture</h2>
 * Both transports drive the same tracker. The socket coordinator keeps its
 * round in memory on its event-loop thread; the shared-memory validator reads
 * the round out of the mapped segment, applies one report, and writes it back
 * under the file lock. Neither changes how a round resolves.
 *
 * <p>The tracker performs no I/O and holds no state. Given a prior round and
 * one report, it computes:</p>
 * <ul>
 *   <li>the next round (the idle round once resolved)</li>
 *   <li>an outcome: pending, match or mismatch</li>
 *   <li>the arrivals dropped when a report for another sync point reset a
 *       partially filled round</li>
 * </ul>
 *
 * <h2>Straggler reset</h2>
 * There is exactly one live round. A report for a different sync point while
 * a round is partially filled starts a fresh round; the old arrivals are
 * discarded and their participants never receive a result for it (they time
 * out). The caller reports the discard.
 */
public final class BarrierTracker
{
    /**
     * Result of applying a report to a round.
     *
     * @param nextRound the round to keep
     * @param outcome   pending, match or mismatch
     * @param discarded arrivals dropped by a straggler reset; usually empty
     */
    public record Result(BarrierRound nextRound,
                         BarrierOutcome outcome,
                         List<Arrival> discarded) {
        public Result {
            Objects.requireNonNull(nextRound, "nextRound");
            Objects.requireNonNull(outcome, "outcome");
            discarded = List.copyOf(Objects.requireNonNull(discarded, "discarded"));
        }
    }

    /**
     * Applies one sync point report.
     *
     * @param round     the current round (idle or partially filled)
     * @param syncPoint sync point sequence carried by the report
     * @param arrival   the reporting participant and its fingerprint
     * @throws IllegalArgumentException if {@code arrival}'s instance already
     *         reported for {@code syncPoint}; see {@link #isDuplicate}
     */
    public Result apply(BarrierRound round, int syncPoint, Arrival arrival) {
        Objects.requireNonNull(round, "round");
        Objects.requireNonNull(arrival, "arrival");
        if (syncPoint == BarrierRound.IDLE_SYNC_POINT) {
            throw new IllegalArgumentException("sync point " + syncPoint + " is reserved for the idle round");
        }

        List<Arrival> discarded = List.of();
        BarrierRound current = round;

        if (current.syncPoint() != syncPoint) {
            discarded = current.arrivals();
            current = BarrierRound.open(syncPoint, round.expected());
        }

        if (current.hasArrivalFrom(arrival.instanceId())) {
            throw new IllegalArgumentException("instance " + arrival.instanceId()
                    + " already reported for sync point " + syncPoint);
        }
        current = current.withArrival(arrival);

        if (!current.isComplete()) {
            return new Result(current, BarrierOutcome.Pending.INSTANCE, discarded);
        }

        BarrierRound idle = BarrierRound.idle(round.expected());
        return new Result(idle, resolve(current), discarded);
    }

    /**
     * @return {@code true} if {@code instanceId} already has an arrival in the
     *         live round for {@code syncPoint}
     */
    public boolean isDuplicate(BarrierRound round, int syncPoint, int instanceId) {
        return round.syncPoint() == syncPoint && round.hasArrivalFrom(instanceId);
    }

    private static BarrierOutcome resolve(BarrierRound complete) {
        List<Arrival> arrivals = complete.arrivals();
        Arrival reference = arrivals.get(0);

        for (int i = 1; i < arrivals.size(); i++) {
            Arrival other = arrivals.get(i);
            ComparisonResult cmp = FingerprintComparator.compare(
                    complete.syncPoint(),
                    reference.instanceId(), reference.fingerprint(),
                    other.instanceId(), other.fingerprint());
            if (!cmp.matched()) {
                return new BarrierOutcome.Mismatch(complete.syncPoint(), arrivals, i, cmp.detail());
            }
        }
        return new BarrierOutcome.Match(complete.syncPoint(), arrivals);
    }
}
