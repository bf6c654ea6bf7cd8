package com.questrail.crossval.client;

import com.questrail.crossval.api.Fingerprint;
import com.questrail.crossval.api.Participant;
import com.questrail.crossval.api.SetupException;
import com.questrail.crossval.api.ValidationOutcome;
import com.questrail.crossval.codec.ValidationRecordCodec;
import com.questrail.crossval.config.ValidationTimingPolicy;
import com.questrail.crossval.failfast.DivergenceHandler;
import com.questrail.crossval.failfast.DivergenceReport;
import com.questrail.crossval.io.ProtocolViolationException;
import com.questrail.crossval.io.ReceiveResult;
import com.questrail.crossval.io.RecordChannel;
import com.questrail.crossval.model.RegisterInstance;
import com.questrail.crossval.model.Shutdown;
import com.questrail.crossval.model.SyncPointReport;
import com.questrail.crossval.model.ValidationMessage;
import com.questrail.crossval.model.ValidationResult;
import com.questrail.crossval.time.Deadline;
import com.questrail.crossval.time.MonotonicClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.StandardSocketOptions;
import java.nio.channels.Selector;
import java.nio.channels.SocketChannel;
import java.util.Objects;

/**
 * ParticipantClient
 * =============================================================================
 * One instance's connection to the coordinator.
 *
 * <h2>Setup</h2>
 * {@link #connect} retries the TCP connect up to
 * {@link ValidationTimingPolicy#connectAttempts()} times, spaced by
 * {@link ValidationTimingPolicy#connectRetryDelay()}, because the coordinator
 * may still be starting. Once connected it sends {@link RegisterInstance}.
 *
 * <h2>Validate</h2>
 * {@link #validate} sends one {@link SyncPointReport} and waits, in
 * {@link ValidationTimingPolicy#pollSlice()} slices, for the
 * {@link ValidationResult} of the same sync point:
 * <ul>
 *   <li>passed → {@link ValidationOutcome#MATCHED}</li>
 *   <li>failed → diagnostics logged, {@link DivergenceHandler} invoked</li>
 *   <li>no result within {@link ValidationTimingPolicy#responseTimeout()} →
 *       warning, {@link ValidationOutcome#TIMED_OUT}</li>
 *   <li>peer closed, protocol violation or I/O error → warning,
 *       {@link ValidationOutcome#FAILED}</li>
 * </ul>
 * A passed result for another sync point (left over from a round that timed
 * out earlier) is skipped. A failed result is acted on whatever its sync
 * point: a late mismatch is still a divergence. A thread interrupt does not cut the wait short; the
 * interrupt status is restored before returning.
 *
 * <h2>Thread Safety</h2>
 * Not thread-safe. Called from the simulation thread only.
 */
public final class ParticipantClient implements Closeable
{
    private static final Logger log = LoggerFactory.getLogger(ParticipantClient.class);

    private final Participant participant;
    private final RecordChannel channel;
    private final Selector selector;
    private final ValidationTimingPolicy timing;
    private final MonotonicClock clock;
    private final DivergenceHandler divergenceHandler;

    private boolean closed;

    private ParticipantClient(Participant participant,
                              RecordChannel channel,
                              Selector selector,
                              ValidationTimingPolicy timing,
                              MonotonicClock clock,
                              DivergenceHandler divergenceHandler)
    {
        this.participant = participant;
        this.channel = channel;
        this.selector = selector;
        this.timing = timing;
        this.clock = clock;
        this.divergenceHandler = divergenceHandler;
    }

    /**
     * Connects to the coordinator and registers {@code participant}.
     *
     * @throws SetupException if no connection could be made within the retry
     *                        budget, or registration could not be sent
     */
    public static ParticipantClient connect(Participant participant,
                                            InetSocketAddress coordinator,
                                            ValidationTimingPolicy timing,
                                            MonotonicClock clock,
                                            DivergenceHandler divergenceHandler) throws SetupException
    {
        Objects.requireNonNull(participant, "participant");
        Objects.requireNonNull(coordinator, "coordinator");
        Objects.requireNonNull(timing, "timing");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(divergenceHandler, "divergenceHandler");

        SocketChannel socket = connectWithRetry(coordinator, timing);

        RecordChannel channel = null;
        Selector selector = null;
        try {
            channel = new RecordChannel(socket, new ValidationRecordCodec(), timing, clock);
            selector = Selector.open();
            channel.registerForRead(selector);
            channel.send(new RegisterInstance(participant.instanceId()));
        } catch (IOException e) {
            closeQuietly(selector);
            closeQuietly(channel != null ? channel : socket);
            throw new SetupException("Failed to register instance " + participant.instanceId()
                    + " with coordinator at " + coordinator, e);
        }

        log.info("Instance {} connected to coordinator at {}", participant.instanceId(), coordinator);
        return new ParticipantClient(participant, channel, selector, timing, clock, divergenceHandler);
    }

    /**
     * Reports a fingerprint and waits for the coordinator's verdict.
     *
     * @param syncPoint    session-unique sync point sequence
     * @param pointOrdinal caller's sync point id, for diagnostics
     */
    public ValidationOutcome validate(int syncPoint, int pointOrdinal, Fingerprint fingerprint)
    {
        Objects.requireNonNull(fingerprint, "fingerprint");
        if (closed) {
            return ValidationOutcome.DISABLED;
        }

        try {
            channel.send(new SyncPointReport(participant.instanceId(), syncPoint, pointOrdinal, fingerprint));
        } catch (IOException e) {
            log.warn("Instance {} failed to send sync point {}: {}",
                    participant.instanceId(), syncPoint, e.toString());
            return ValidationOutcome.FAILED;
        }

        return awaitResult(syncPoint, fingerprint);
    }

    private ValidationOutcome awaitResult(int syncPoint, Fingerprint local)
    {
        Deadline deadline = Deadline.after(timing.responseTimeout(), clock);
        boolean interrupted = false;
        try {
            while (!deadline.hasExpired()) {
                long sliceMillis = Math.max(1L, deadline.nextSlice(timing.pollSlice()).toMillis());
                selector.select(sliceMillis);
                selector.selectedKeys().clear();
                if (Thread.interrupted()) {
                    // select returns at once while the flag is set; clear it and keep waiting
                    interrupted = true;
                }

                ReceiveResult r = channel.receive(deadline);
                while (r.status() == ReceiveResult.Status.MESSAGE) {
                    ValidationMessage message = r.message().orElseThrow();
                    if (message instanceof ValidationResult result) {
                        if (result.syncPoint() == syncPoint) {
                            return onResult(result, local);
                        }
                        if (!result.passed()) {
                            return onLateFailure(result, syncPoint);
                        }
                    }
                    log.debug("Instance {} skipping {} while waiting for sync point {}",
                            participant.instanceId(), message, syncPoint);
                    r = channel.receive(deadline);
                }
                if (r.status() == ReceiveResult.Status.CLOSED) {
                    log.warn("Instance {}: coordinator closed the connection while waiting for sync point {}",
                            participant.instanceId(), syncPoint);
                    return ValidationOutcome.FAILED;
                }
                if (Thread.interrupted()) {
                    interrupted = true;
                }
            }

            log.warn("Instance {}: timeout waiting for validation result at sync point {}",
                    participant.instanceId(), syncPoint);
            return ValidationOutcome.TIMED_OUT;
        } catch (ProtocolViolationException e) {
            log.warn("Instance {}: protocol violation while waiting for sync point {}: {}",
                    participant.instanceId(), syncPoint, e.getMessage());
            return ValidationOutcome.FAILED;
        } catch (IOException e) {
            log.warn("Instance {}: receive failed while waiting for sync point {}: {}",
                    participant.instanceId(), syncPoint, e.toString());
            return ValidationOutcome.FAILED;
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private ValidationOutcome onResult(ValidationResult result, Fingerprint local)
    {
        if (result.passed()) {
            log.debug("Instance {}: sync point {} validated", participant.instanceId(), result.syncPoint());
            return ValidationOutcome.MATCHED;
        }

        log.error("VALIDATION FAILED at sync point {}", result.syncPoint());
        log.error("  Local fingerprint (instance {}): '{}'", participant.instanceId(), local.text());
        if (!result.peerFingerprint().isEmpty()) {
            log.error("  Other fingerprint: '{}'", result.peerFingerprint().text());
        }

        String detail = result.peerFingerprint().isEmpty()
                ? String.format("Instance %d='%s'", participant.instanceId(), local.text())
                : String.format("Instance %d='%s' vs other='%s'",
                        participant.instanceId(), local.text(), result.peerFingerprint().text());
        divergenceHandler.onDivergence(
                new DivergenceReport(DivergenceReport.Origin.PARTICIPANT, result.syncPoint(), detail));
        return ValidationOutcome.DIVERGED;
    }

    /**
     * A mismatch for an earlier sync point, typically one this instance
     * already gave up on after a timeout.
     */
    private ValidationOutcome onLateFailure(ValidationResult result, int awaited)
    {
        log.error("VALIDATION FAILED at earlier sync point {} (reported while waiting for {})",
                result.syncPoint(), awaited);
        String detail;
        if (result.peerFingerprint().isEmpty()) {
            detail = String.format("Instance %d diverged at sync point %d",
                    participant.instanceId(), result.syncPoint());
        }
        else {
            log.error("  Other fingerprint: '{}'", result.peerFingerprint().text());
            detail = String.format("Instance %d diverged at sync point %d; other='%s'",
                    participant.instanceId(), result.syncPoint(), result.peerFingerprint().text());
        }
        divergenceHandler.onDivergence(
                new DivergenceReport(DivergenceReport.Origin.PARTICIPANT, result.syncPoint(), detail));
        return ValidationOutcome.DIVERGED;
    }

    /**
     * Announces shutdown to the coordinator and closes the connection.
     * Idempotent; failures are logged, not thrown.
     */
    public void shutdown()
    {
        if (closed) {
            return;
        }
        try {
            channel.send(new Shutdown(participant.instanceId()));
        } catch (IOException e) {
            log.debug("Instance {}: shutdown notice not delivered: {}", participant.instanceId(), e.toString());
        }
        close();
    }

    /**
     * Closes the connection without notifying the coordinator.
     */
    @Override
    public void close()
    {
        if (closed) {
            return;
        }
        closed = true;
        closeQuietly(selector);
        closeQuietly(channel);
    }

    public boolean isClosed()
    {
        return closed;
    }

    private static SocketChannel connectWithRetry(InetSocketAddress coordinator,
                                                  ValidationTimingPolicy timing) throws SetupException
    {
        int connectTimeoutMillis = (int) Math.min(Integer.MAX_VALUE, timing.responseTimeout().toMillis());
        IOException last = null;

        for (int attempt = 1; attempt <= timing.connectAttempts(); attempt++) {
            SocketChannel socket = null;
            try {
                socket = SocketChannel.open();
                socket.setOption(StandardSocketOptions.TCP_NODELAY, true);
                socket.socket().connect(coordinator, connectTimeoutMillis);
                return socket;
            } catch (IOException e) {
                closeQuietly(socket);
                last = e;
                log.debug("Connect attempt {}/{} to {} failed: {}",
                        attempt, timing.connectAttempts(), coordinator, e.toString());
            }

            if (attempt < timing.connectAttempts()) {
                try {
                    Thread.sleep(timing.connectRetryDelay().toMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new SetupException("Interrupted while connecting to " + coordinator, e);
                }
            }
        }
        throw new SetupException("Failed to connect to coordinator at " + coordinator
                + " after " + timing.connectAttempts() + " attempts", last);
    }

    private static void closeQuietly(Closeable c)
    {
        if (c == null) {
            return;
        }
        try {
            c.close();
        } catch (IOException e) {
            log.debug("Ignoring close failure: {}", e.toString());
        }
    }
}
