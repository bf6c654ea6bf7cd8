package com.questrail.crossval.session;

import com.questrail.crossval.api.Fingerprint;
import com.questrail.crossval.api.Participant;
import com.questrail.crossval.api.SetupException;
import com.questrail.crossval.api.SyncPointId;
import com.questrail.crossval.api.ValidationOutcome;
import com.questrail.crossval.client.ParticipantClient;
import com.questrail.crossval.codec.ValidationRecordCodec;
import com.questrail.crossval.config.CrossValidationConfig;
import com.questrail.crossval.coordinator.ValidationCoordinator;
import com.questrail.crossval.failfast.DivergenceHandler;
import com.questrail.crossval.failfast.DivergenceReport;
import com.questrail.crossval.failfast.HaltingDivergenceHandler;
import com.questrail.crossval.observability.Slf4jValidationObservabilitySink;
import com.questrail.crossval.observability.ValidationObservabilitySink;
import com.questrail.crossval.shm.SharedMemorySegment;
import com.questrail.crossval.shm.SharedMemoryValidator;
import com.questrail.crossval.time.MonotonicClock;
import com.questrail.crossval.time.SystemMonotonicClock;
import com.questrail.crossval.transport.StreamServerEndpoint;
import com.questrail.crossval.transport.netty.NettyTcpServerEndpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Function;

/**
 * CrossValidationSession
 * =============================================================================
 * Composition root and lifecycle owner for one instance's participation in
 * cross-validation. This is the object a simulation holds.
 *
 * <h2>Caller API</h2>
 * <ul>
 *   <li>{@link #initialize()}: bring up the configured transport. Instance 0
 *       starts the coordinator first. Failure is logged and leaves validation
 *       disabled; it never throws.</li>
 *   <li>{@link #validate(SyncPointId, Fingerprint)}: report a fingerprint and
 *       wait for the verdict. A no-op unless {@link SessionState#ACTIVE}.</li>
 *   <li>{@link #validateOrFail(SyncPointId, Fingerprint)}: as {@code validate},
 *       then escalate a divergence recorded in the shared segment.</li>
 *   <li>{@link #shutdown()}: notify peers and release everything. Idempotent.</li>
 * </ul>
 *
 * <h2>Checkpoint hooks</h2>
 * A checkpoint/restart orchestrator calls {@link #suspend()} before a
 * checkpoint and {@link #resume()} after restart. Suspend tears the transport
 * down without draining; resume waits for the peers to settle, restarts
 * sync point numbering and brings the transport up again with the same ids.
 *
 * <h2>Threading</h2>
 * Public methods are synchronized. A hook called while {@code validate} is
 * blocked waits for it, bounded by the response timeout.
 */
public final class CrossValidationSession implements AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(CrossValidationSession.class);

    private final CrossValidationConfig config;
    private final ValidationObservabilitySink observabilitySink;
    private final DivergenceHandler divergenceHandler;
    private final MonotonicClock monotonicClock;
    private final Clock wallClock;
    private final Function<InetSocketAddress, StreamServerEndpoint> endpointFactory;

    private final SyncPointSequencer sequencer = new SyncPointSequencer();

    private SessionState state = SessionState.NEW;
    private ValidationEngine engine;

    private CrossValidationSession(Builder b) {
        this.config = b.config;
        this.observabilitySink = b.observabilitySink;
        this.divergenceHandler = b.divergenceHandler;
        this.monotonicClock = b.monotonicClock;
        this.wallClock = b.wallClock;
        this.endpointFactory = b.endpointFactory;
    }

    /**
     * Brings up the configured transport.
     *
     * @return {@code true} if validation is active
     */
    public synchronized boolean initialize() {
        if (state == SessionState.ACTIVE) {
            return true;
        }
        if (state != SessionState.NEW && state != SessionState.DISABLED) {
            throw new IllegalStateException("cannot initialize a session in state " + state);
        }
        return activate();
    }

    /**
     * Reports {@code fingerprint} for {@code point} and waits for the verdict.
     * A divergence reaches the divergence handler before this returns.
     */
    public synchronized ValidationOutcome validate(SyncPointId point, Fingerprint fingerprint) {
        Objects.requireNonNull(point, "point");
        Objects.requireNonNull(fingerprint, "fingerprint");
        if (state != SessionState.ACTIVE) {
            return ValidationOutcome.DISABLED;
        }
        int syncPoint = sequencer.next();
        return engine.validate(syncPoint, point.ordinal(), fingerprint);
    }

    /**
     * As {@link #validate}, then reports a divergence recorded in the shared
     * segment, whichever instance detected it.
     */
    public synchronized ValidationOutcome validateOrFail(SyncPointId point, Fingerprint fingerprint) {
        ValidationOutcome outcome = validate(point, fingerprint);
        if (state == SessionState.ACTIVE && engine.validationFailed()) {
            String detail = engine.mismatchDetail();
            log.error("Cross-validation failure recorded at {} (sync point {}): {}",
                    point.name(), sequencer.current(), detail);
            divergenceHandler.onDivergence(new DivergenceReport(
                    DivergenceReport.Origin.SHARED_MEMORY, sequencer.current(), detail));
            return ValidationOutcome.DIVERGED;
        }
        return outcome;
    }

    /**
     * Pre-checkpoint hook. Disables validation and releases the transport
     * without notifying peers.
     */
    public synchronized void suspend() {
        if (state != SessionState.ACTIVE) {
            return;
        }
        log.info("Instance {}: suspending cross-validation for checkpoint", participant().instanceId());
        state = SessionState.SUSPENDED;
        engine.abandon();
        engine = null;
    }

    /**
     * Post-restart hook. Waits for peers to settle, then re-initialises with
     * the same instance ids and a fresh sync point sequence.
     *
     * @return {@code true} if validation is active again
     */
    public synchronized boolean resume() {
        if (state != SessionState.SUSPENDED) {
            return state == SessionState.ACTIVE;
        }
        log.info("Instance {}: resuming cross-validation", participant().instanceId());
        if (!pause(config.timing().resumeSettleDelay())) {
            log.warn("Instance {}: interrupted while resuming; validation stays disabled",
                    participant().instanceId());
            state = SessionState.DISABLED;
            return false;
        }
        sequencer.reset();
        return activate();
    }

    /**
     * Notifies peers and releases everything. Idempotent.
     */
    public synchronized void shutdown() {
        if (state == SessionState.CLOSED) {
            return;
        }
        if (engine != null) {
            engine.shutdown();
            engine = null;
        }
        state = SessionState.CLOSED;
        log.info("Instance {}: cross-validation shut down", participant().instanceId());
    }

    @Override
    public void close() {
        shutdown();
    }

    public synchronized SessionState state() {
        return state;
    }

    public Participant participant() {
        return config.participant();
    }

    private boolean activate() {
        try {
            engine = openEngine();
            state = SessionState.ACTIVE;
            log.info("Instance {}/{}: cross-validation active over {}",
                    participant().instanceId(), participant().instanceCount(), config.transport());
            return true;
        } catch (SetupException e) {
            log.error("Instance {}: cross-validation disabled: {}", participant().instanceId(), e.getMessage(), e);
            state = SessionState.DISABLED;
            return false;
        }
    }

    private ValidationEngine openEngine() throws SetupException {
        switch (config.transport()) {
            case SOCKET:
                return openSocketEngine();
            case SHM:
                return openSharedMemoryEngine();
            default:
                throw new IllegalStateException("unhandled transport " + config.transport());
        }
    }

    private ValidationEngine openSocketEngine() throws SetupException {
        Participant participant = participant();
        InetSocketAddress target = config.coordinatorAddress();

        ValidationCoordinator coordinator = null;
        if (participant.isCoordinator()) {
            coordinator = new ValidationCoordinator(
                    endpointFactory.apply(config.bindAddress()),
                    participant.instanceCount(),
                    config.timing(),
                    observabilitySink,
                    divergenceHandler,
                    wallClock);
            InetSocketAddress bound = coordinator.start();
            target = config.withServerPort(bound.getPort()).coordinatorAddress();
        }

        try {
            awaitInitialContact();
            ParticipantClient client = ParticipantClient.connect(
                    participant, target, config.timing(), monotonicClock, divergenceHandler);
            return new SocketValidationEngine(coordinator, client);
        } catch (SetupException e) {
            if (coordinator != null) {
                coordinator.shutdown();
            }
            throw e;
        }
    }

    private ValidationEngine openSharedMemoryEngine() throws SetupException {
        Participant participant = participant();
        SharedMemorySegment segment;
        if (participant.isCoordinator()) {
            segment = SharedMemorySegment.create(config.segmentPath(), participant.instanceCount());
        }
        else {
            awaitInitialContact();
            segment = SharedMemorySegment.open(config.segmentPath(), participant.instanceCount(), config.timing());
        }
        return new SharedMemoryValidationEngine(new SharedMemoryValidator(participant, segment));
    }

    private void awaitInitialContact() throws SetupException {
        if (!pause(config.timing().initialContactDelay())) {
            throw new SetupException("Interrupted before initial contact");
        }
    }

    /**
     * @return {@code false} if interrupted; the interrupt status is restored
     */
    private static boolean pause(Duration d) {
        if (d.isZero()) {
            return true;
        }
        try {
            Thread.sleep(d.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private CrossValidationConfig config;
        private ValidationObservabilitySink observabilitySink = new Slf4jValidationObservabilitySink();
        private DivergenceHandler divergenceHandler = HaltingDivergenceHandler.INSTANCE;
        private MonotonicClock monotonicClock = SystemMonotonicClock.INSTANCE;
        private Clock wallClock = Clock.systemUTC();
        private Function<InetSocketAddress, StreamServerEndpoint> endpointFactory =
                address -> new NettyTcpServerEndpoint(address, ValidationRecordCodec.RECORD_SIZE);

        public Builder withConfig(CrossValidationConfig config) {
            this.config = config;
            return this;
        }

        public Builder withObservabilitySink(ValidationObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withDivergenceHandler(DivergenceHandler handler) {
            this.divergenceHandler = handler;
            return this;
        }

        public Builder withMonotonicClock(MonotonicClock clock) {
            this.monotonicClock = clock;
            return this;
        }

        public Builder withWallClock(Clock clock) {
            this.wallClock = clock;
            return this;
        }

        public Builder withEndpointFactory(Function<InetSocketAddress, StreamServerEndpoint> factory) {
            this.endpointFactory = factory;
            return this;
        }

        public CrossValidationSession build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            Objects.requireNonNull(divergenceHandler, "divergenceHandler");
            Objects.requireNonNull(monotonicClock, "monotonicClock");
            Objects.requireNonNull(wallClock, "wallClock");
            Objects.requireNonNull(endpointFactory, "endpointFactory");
            return new CrossValidationSession(this);
        }
    }
}
