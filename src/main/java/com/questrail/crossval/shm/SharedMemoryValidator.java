package com.questrail.crossval.shm;

import com.questrail.crossval.api.Fingerprint;
import com.questrail.crossval.api.Participant;
import com.questrail.crossval.api.ValidationOutcome;
import com.questrail.crossval.barrier.Arrival;
import com.questrail.crossval.barrier.BarrierOutcome;
import com.questrail.crossval.barrier.BarrierRound;
import com.questrail.crossval.barrier.BarrierTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.channels.FileLock;
import java.util.Objects;

/**
 * SharedMemoryValidator
 * =============================================================================
 * Single-host validation through a {@link SharedMemorySegment}.
 *
 * <p>There is no coordinator. Each call takes the segment lock with one
 * non-blocking attempt, applies this instance's report to the round stored in
 * the segment using the same {@link BarrierTracker} as the socket coordinator,
 * writes the round back and releases the lock. The instance whose report
 * completes a round performs the comparison.</p>
 *
 * <ul>
 *   <li>lock busy → {@link ValidationOutcome#SKIPPED}; this sync point is not checked</li>
 *   <li>round still filling → {@link ValidationOutcome#RECORDED}</li>
 *   <li>round complete, all agree → {@link ValidationOutcome#MATCHED}</li>
 *   <li>round complete, disagreement → failed flag and detail written to the
 *       segment, {@link ValidationOutcome#DIVERGED}; nothing aborts here</li>
 * </ul>
 *
 * <p>Callers poll {@link #validationFailed()} to react to a divergence,
 * including one detected by another instance.</p>
 */
public final class SharedMemoryValidator implements Closeable
{
    private static final Logger log = LoggerFactory.getLogger(SharedMemoryValidator.class);

    private final Participant participant;
    private final SharedMemorySegment segment;
    private final BarrierTracker tracker = new BarrierTracker();

    public SharedMemoryValidator(Participant participant, SharedMemorySegment segment)
    {
        this.participant = Objects.requireNonNull(participant, "participant");
        this.segment = Objects.requireNonNull(segment, "segment");
    }

    public ValidationOutcome validate(int syncPoint, Fingerprint fingerprint)
    {
        Objects.requireNonNull(fingerprint, "fingerprint");

        final FileLock lock;
        try {
            lock = segment.tryLock();
        } catch (IOException e) {
            log.warn("Instance {}: cannot lock shared segment: {}", participant.instanceId(), e.toString());
            return ValidationOutcome.FAILED;
        }
        if (lock == null) {
            log.debug("Instance {}: shared segment busy, skipping sync point {}",
                    participant.instanceId(), syncPoint);
            return ValidationOutcome.SKIPPED;
        }

        try {
            BarrierRound round = segment.readRound();
            if (tracker.isDuplicate(round, syncPoint, participant.instanceId())) {
                log.warn("Instance {}: already reported sync point {}; ignoring repeat",
                        participant.instanceId(), syncPoint);
                return ValidationOutcome.FAILED;
            }
            BarrierTracker.Result result = tracker.apply(round, syncPoint,
                    new Arrival(participant.instanceId(), fingerprint));

            if (!result.discarded().isEmpty()) {
                log.warn("Instance {}: sync point {} replaced an unfinished round holding {} arrivals",
                        participant.instanceId(), syncPoint, result.discarded().size());
            }
            segment.writeRound(result.nextRound());

            ValidationOutcome outcome;
            BarrierOutcome barrier = result.outcome();
            if (barrier instanceof BarrierOutcome.Mismatch m) {
                segment.markFailed(m.detail());
                log.error("VALIDATION FAILED at sync point {}: {}", m.syncPoint(), m.detail());
                outcome = ValidationOutcome.DIVERGED;
            }
            else if (barrier instanceof BarrierOutcome.Match) {
                outcome = ValidationOutcome.MATCHED;
            }
            else {
                outcome = ValidationOutcome.RECORDED;
            }
            segment.force();
            return outcome;
        } finally {
            release(lock);
        }
    }

    public boolean validationFailed()
    {
        return segment.validationFailed();
    }

    public String mismatchDetail()
    {
        return segment.mismatchDetail();
    }

    @Override
    public void close() throws IOException
    {
        segment.close();
    }

    private void release(FileLock lock)
    {
        try {
            lock.release();
        } catch (IOException e) {
            log.warn("Instance {}: failed to release shared segment lock: {}",
                    participant.instanceId(), e.toString());
        }
    }
}
