package com.questrail.crossval.coordinator;

import com.questrail.crossval.api.Fingerprint;
import com.questrail.crossval.api.SetupException;
import com.questrail.crossval.barrier.Arrival;
import com.questrail.crossval.barrier.BarrierOutcome;
import com.questrail.crossval.barrier.BarrierRound;
import com.questrail.crossval.barrier.BarrierTracker;
import com.questrail.crossval.codec.ValidationRecordCodec;
import com.questrail.crossval.codec.WireDecodeException;
import com.questrail.crossval.config.ValidationTimingPolicy;
import com.questrail.crossval.failfast.DivergenceHandler;
import com.questrail.crossval.failfast.DivergenceReport;
import com.questrail.crossval.io.ProtocolViolationException;
import com.questrail.crossval.model.RegisterInstance;
import com.questrail.crossval.model.Shutdown;
import com.questrail.crossval.model.SyncPointReport;
import com.questrail.crossval.model.ValidationMessage;
import com.questrail.crossval.model.ValidationResult;
import com.questrail.crossval.observability.ConnectionEvent;
import com.questrail.crossval.observability.PhaseTransitionEvent;
import com.questrail.crossval.observability.RoundDiscardedEvent;
import com.questrail.crossval.observability.RoundResolvedEvent;
import com.questrail.crossval.observability.ValidationErrorEvent;
import com.questrail.crossval.observability.ValidationObservabilitySink;
import com.questrail.crossval.transport.ConnectionId;
import com.questrail.crossval.transport.StreamServerEndpoint;
import com.questrail.crossval.transport.StreamServerListener;

import java.net.InetSocketAddress;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * ValidationCoordinator
 * =============================================================================
 * Central barrier-and-compare authority, hosted by instance 0.
 *
 * <h2>Responsibilities</h2>
 * <ul>
 *   <li>Bind participant connections to instance ids on {@link RegisterInstance}</li>
 *   <li>Feed every {@link SyncPointReport} into the {@link BarrierTracker}</li>
 *   <li>Broadcast a {@link ValidationResult} to every participant in a resolved round</li>
 *   <li>Abort the process, through the {@link DivergenceHandler}, on a mismatch</li>
 * </ul>
 *
 * <h2>Threading</h2>
 * The coordinator holds no locks. Every endpoint callback arrives serially on
 * the endpoint's single I/O thread, and only that thread touches the
 * registration maps and the live round. {@link #phase()} may be read from any
 * thread.
 *
 * <h2>Fail-fast ordering</h2>
 * On a mismatch the results are broadcast first, so every participant observes
 * {@code passed=false}. The divergence handler runs once all of those writes
 * have completed, or after {@link ValidationTimingPolicy#abortFlushTimeout()},
 * whichever comes first. From that point the coordinator ignores all traffic.
 *
 * <h2>Registration</h2>
 * Registration completes once every instance id in {@code [0, N)} has
 * registered. Sync point traffic from already registered participants is
 * accepted while stragglers are still connecting. Losing a registered
 * participant before registration completes fails the coordinator for the rest
 * of the run; after that, a lost participant only loses its connection.
 */
public final class ValidationCoordinator
{
    private final StreamServerEndpoint endpoint;
    private final int instanceCount;
    private final ValidationTimingPolicy timing;
    private final ValidationObservabilitySink sink;
    private final DivergenceHandler divergenceHandler;
    private final Clock clock;

    private final ValidationRecordCodec codec = new ValidationRecordCodec();
    private final BarrierTracker tracker = new BarrierTracker();

    // I/O thread confined
    private final Map<ConnectionId, Integer> instanceByConnection = new HashMap<>();
    private final Map<Integer, ConnectionId> connectionByInstance = new HashMap<>();
    private BarrierRound round;

    private volatile CoordinatorPhase phase = CoordinatorPhase.CREATED;

    public ValidationCoordinator(StreamServerEndpoint endpoint,
                                 int instanceCount,
                                 ValidationTimingPolicy timing,
                                 ValidationObservabilitySink sink,
                                 DivergenceHandler divergenceHandler,
                                 Clock clock)
    {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        if (instanceCount < 1) {
            throw new IllegalArgumentException("instanceCount must be >= 1");
        }
        this.instanceCount = instanceCount;
        this.timing = Objects.requireNonNull(timing, "timing");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.divergenceHandler = Objects.requireNonNull(divergenceHandler, "divergenceHandler");
        this.clock = Objects.requireNonNull(clock, "clock");

        this.round = BarrierRound.idle(instanceCount);
    }

    /**
     * Binds the endpoint and begins accepting participants.
     *
     * @return the address actually bound
     * @throws SetupException if the endpoint cannot listen
     */
    public InetSocketAddress start() throws SetupException
    {
        if (phase != CoordinatorPhase.CREATED) {
            throw new IllegalStateException("coordinator already started (phase " + phase + ")");
        }
        endpoint.setListener(new EndpointEvents());
        InetSocketAddress bound = endpoint.start();
        transition(CoordinatorPhase.LISTENING);
        return bound;
    }

    /**
     * Stops the endpoint abruptly. Participants waiting for a result time out
     * on their own. Idempotent.
     */
    public void shutdown()
    {
        CoordinatorPhase current = phase;
        if (current != CoordinatorPhase.ABORTED && current != CoordinatorPhase.SHUT_DOWN) {
            transition(CoordinatorPhase.SHUT_DOWN);
        }
        endpoint.stop();
    }

    public CoordinatorPhase phase()
    {
        return phase;
    }

    // ---------------------------------------------------------------------
    // Inbound handling
    // ---------------------------------------------------------------------

    private void onOpened(ConnectionId connection)
    {
        sink.onConnectionEvent(new ConnectionEvent(clock.instant(),
                ConnectionEvent.Kind.OPENED, connection, ConnectionEvent.UNREGISTERED));
        if (phase == CoordinatorPhase.LISTENING) {
            transition(CoordinatorPhase.REGISTERING);
        }
    }

    private void onRecord(ConnectionId connection, byte[] record)
    {
        if (phase.isTerminal()) {
            return;
        }

        final ValidationMessage message;
        try {
            message = codec.decode(record);
        } catch (WireDecodeException e) {
            dropConnection(connection, "Undecodable record from " + connection, e);
            return;
        }

        if (message instanceof RegisterInstance m) {
            onRegister(connection, m);
        }
        else if (message instanceof SyncPointReport m) {
            onSyncPoint(connection, m);
        }
        else if (message instanceof Shutdown m) {
            sink.onConnectionEvent(new ConnectionEvent(clock.instant(),
                    ConnectionEvent.Kind.SHUTDOWN_RECEIVED, connection, m.instanceId()));
        }
        else {
            dropConnection(connection, "Unexpected " + message.kind() + " from " + connection,
                    new ProtocolViolationException("participants never send " + message.kind()));
        }
    }

    private void onRegister(ConnectionId connection, RegisterInstance m)
    {
        int id = m.instanceId();
        if (id < 0 || id >= instanceCount) {
            dropConnection(connection, "Registration from " + connection + " rejected",
                    new ProtocolViolationException(
                            "instance id " + id + " outside [0, " + instanceCount + ")"));
            return;
        }

        ConnectionId previous = connectionByInstance.put(id, connection);
        if (previous != null && !previous.equals(connection)) {
            instanceByConnection.remove(previous);
        }
        instanceByConnection.put(connection, id);

        sink.onConnectionEvent(new ConnectionEvent(clock.instant(),
                ConnectionEvent.Kind.REGISTERED, connection, id));

        if (phase == CoordinatorPhase.REGISTERING && connectionByInstance.size() == instanceCount) {
            transition(CoordinatorPhase.STEADY_STATE);
        }
    }

    private void onSyncPoint(ConnectionId connection, SyncPointReport m)
    {
        Integer registered = instanceByConnection.get(connection);
        if (registered == null || registered != m.instanceId()) {
            dropConnection(connection, "Sync point report from " + connection + " rejected",
                    new ProtocolViolationException("report for instance " + m.instanceId()
                            + " on connection registered as " + registered));
            return;
        }

        if (tracker.isDuplicate(round, m.syncPoint(), m.instanceId())) {
            dropConnection(connection, "Duplicate sync point report from " + connection,
                    new ProtocolViolationException("instance " + m.instanceId()
                            + " reported sync point " + m.syncPoint() + " twice"));
            return;
        }

        BarrierTracker.Result result = tracker.apply(round, m.syncPoint(),
                new Arrival(m.instanceId(), m.fingerprint()));

        if (!result.discarded().isEmpty()) {
            sink.onRoundDiscarded(new RoundDiscardedEvent(clock.instant(),
                    round.syncPoint(), m.syncPoint(), result.discarded()));
        }
        round = result.nextRound();

        BarrierOutcome outcome = result.outcome();
        if (!outcome.isResolved()) {
            return;
        }

        sink.onRoundResolved(new RoundResolvedEvent(clock.instant(), outcome));

        if (outcome instanceof BarrierOutcome.Match match) {
            broadcast(match.syncPoint(), match.arrivals(), true);
        }
        else if (outcome instanceof BarrierOutcome.Mismatch mismatch) {
            transition(CoordinatorPhase.ABORTED);
            CompletableFuture<Void> flushed = broadcast(mismatch.syncPoint(), mismatch.arrivals(), false);
            DivergenceReport report = new DivergenceReport(
                    DivergenceReport.Origin.COORDINATOR, mismatch.syncPoint(), mismatch.detail());
            flushed.completeOnTimeout(null, timing.abortFlushTimeout().toMillis(), TimeUnit.MILLISECONDS)
                    .whenComplete((ignored, writeFailure) -> divergenceHandler.onDivergence(report));
        }
    }

    /**
     * Sends one result to every participant in the round still connected.
     * With exactly two participants each result carries the other's fingerprint.
     */
    private CompletableFuture<Void> broadcast(int syncPoint, List<Arrival> arrivals, boolean passed)
    {
        List<CompletableFuture<Void>> writes = new ArrayList<>(arrivals.size());

        for (Arrival arrival : arrivals) {
            ConnectionId target = connectionByInstance.get(arrival.instanceId());
            if (target == null) {
                continue;
            }
            Fingerprint peer = Fingerprint.empty();
            if (instanceCount == 2) {
                for (Arrival other : arrivals) {
                    if (other.instanceId() != arrival.instanceId()) {
                        peer = other.fingerprint();
                    }
                }
            }
            byte[] record = codec.encode(new ValidationResult(syncPoint, passed, peer));
            writes.add(endpoint.send(target, record).toCompletableFuture());
        }
        return CompletableFuture.allOf(writes.toArray(new CompletableFuture<?>[0]));
    }

    private void onClosed(ConnectionId connection, Throwable cause)
    {
        Integer instance = instanceByConnection.remove(connection);
        if (instance != null) {
            connectionByInstance.remove(instance, connection);
        }

        if (cause instanceof ProtocolViolationException) {
            sink.onError(new ValidationErrorEvent(clock.instant(),
                    "Protocol violation on " + connection, cause));
        }

        sink.onConnectionEvent(new ConnectionEvent(clock.instant(), ConnectionEvent.Kind.CLOSED,
                connection, instance == null ? ConnectionEvent.UNREGISTERED : instance));

        if (phase == CoordinatorPhase.REGISTERING && instance != null) {
            sink.onError(new ValidationErrorEvent(clock.instant(),
                    "Instance " + instance + " lost during registration", cause));
            transition(CoordinatorPhase.FAILED);
        }
    }

    private void dropConnection(ConnectionId connection, String message, Throwable cause)
    {
        sink.onError(new ValidationErrorEvent(clock.instant(), message, cause));
        endpoint.close(connection);
    }

    private void transition(CoordinatorPhase to)
    {
        CoordinatorPhase from = phase;
        if (from == to) {
            return;
        }
        phase = to;
        sink.onPhaseTransition(new PhaseTransitionEvent(clock.instant(), from, to));
    }

    /**
     * Adapts endpoint callbacks onto the coordinator without exposing them
     * as public coordinator API.
     */
    private final class EndpointEvents implements StreamServerListener
    {
        @Override
        public void onConnectionOpened(ConnectionId connection)
        {
            onOpened(connection);
        }

        @Override
        public void onRecord(ConnectionId connection, byte[] record)
        {
            ValidationCoordinator.this.onRecord(connection, record);
        }

        @Override
        public void onConnectionClosed(ConnectionId connection, Throwable cause)
        {
            onClosed(connection, cause);
        }
    }
}
