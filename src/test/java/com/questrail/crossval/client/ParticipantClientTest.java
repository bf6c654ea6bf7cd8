package com.questrail.crossval.client;

import com.questrail.crossval.api.Fingerprint;
import com.questrail.crossval.api.Participant;
import com.questrail.crossval.api.SetupException;
import com.questrail.crossval.api.ValidationOutcome;
import com.questrail.crossval.codec.ValidationRecordCodec;
import com.questrail.crossval.config.ValidationTimingPolicy;
import com.questrail.crossval.failfast.DivergenceReport;
import com.questrail.crossval.failfast.RecordingDivergenceHandler;
import com.questrail.crossval.model.RegisterInstance;
import com.questrail.crossval.model.Shutdown;
import com.questrail.crossval.model.SyncPointReport;
import com.questrail.crossval.model.ValidationMessage;
import com.questrail.crossval.model.ValidationResult;
import com.questrail.crossval.time.SystemMonotonicClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ParticipantClientTest
 * -----------------------------------------------------------------------------
 * The client against a scripted coordinator: a plain blocking socket on the
 * far end that the test reads from and writes to directly.
 */
final class ParticipantClientTest {

    private static final ValidationTimingPolicy FAST = new ValidationTimingPolicy(
            Duration.ofMillis(300),
            Duration.ofMillis(20),
            Duration.ofMillis(5),
            Duration.ofMillis(10),
            3,
            Duration.ZERO,
            Duration.ZERO,
            Duration.ofMillis(100));

    private final ValidationRecordCodec codec = new ValidationRecordCodec();
    private final RecordingDivergenceHandler divergence = new RecordingDivergenceHandler();
    private final Participant participant = new Participant(1, 2);

    private ServerSocketChannel server;
    private ParticipantClient client;
    private SocketChannel coordinator;

    @BeforeEach
    void connect() throws Exception {
        server = ServerSocketChannel.open();
        server.bind(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0));
        client = ParticipantClient.connect(participant, (InetSocketAddress) server.getLocalAddress(),
                FAST, SystemMonotonicClock.INSTANCE, divergence);
        coordinator = server.accept();
        assertEquals(new RegisterInstance(1), read());
    }

    @AfterEach
    void close() throws IOException {
        Thread.interrupted();
        client.close();
        coordinator.close();
        server.close();
    }

    private ValidationMessage read() throws IOException {
        ByteBuffer in = ByteBuffer.allocate(ValidationRecordCodec.RECORD_SIZE);
        while (in.hasRemaining()) {
            if (coordinator.read(in) < 0) {
                throw new IOException("client closed");
            }
        }
        return codec.decode(in.array());
    }

    private void write(ValidationMessage message) throws IOException {
        ByteBuffer out = ByteBuffer.wrap(codec.encode(message));
        while (out.hasRemaining()) {
            coordinator.write(out);
        }
    }

    @Test
    void passedResultIsMatched() throws Exception {
        write(new ValidationResult(1, true, Fingerprint.empty()));

        assertEquals(ValidationOutcome.MATCHED, client.validate(1, 4, Fingerprint.of("x=1")));
        assertEquals(new SyncPointReport(1, 1, 4, Fingerprint.of("x=1")), read());
    }

    @Test
    void stalePassForAnotherSyncPointIsSkipped() throws Exception {
        write(new ValidationResult(1, true, Fingerprint.empty()));
        write(new ValidationResult(2, true, Fingerprint.empty()));

        assertEquals(ValidationOutcome.MATCHED, client.validate(2, 0, Fingerprint.of("x=1")));
        assertTrue(divergence.reports().isEmpty());
    }

    @Test
    void lateFailureForAnEarlierSyncPointIsStillADivergence() throws Exception {
        assertEquals(ValidationOutcome.TIMED_OUT, client.validate(1, 0, Fingerprint.of("v=1.0")));
        assertEquals(new SyncPointReport(1, 1, 0, Fingerprint.of("v=1.0")), read());

        // the coordinator resolves sync point 1 only after the client gave up on it
        write(new ValidationResult(1, false, Fingerprint.of("v=2.0")));

        assertEquals(ValidationOutcome.DIVERGED, client.validate(2, 0, Fingerprint.of("v=1.0")));
        assertEquals(1, divergence.reports().size());
        DivergenceReport report = divergence.reports().get(0);
        assertEquals(DivergenceReport.Origin.PARTICIPANT, report.origin());
        assertEquals(1, report.syncPoint());
        assertTrue(report.detail().contains("v=2.0"));
    }

    @Test
    void stalledPartialResultDoesNotStretchTheWait() throws Exception {
        client.close();
        coordinator.close();
        ValidationTimingPolicy slowStall = FAST.withResponseTimeout(Duration.ofMillis(400));
        client = ParticipantClient.connect(participant, (InetSocketAddress) server.getLocalAddress(),
                slowStall, SystemMonotonicClock.INSTANCE, divergence);
        coordinator = server.accept();
        assertEquals(new RegisterInstance(1), read());

        // part of a result arrives halfway through the wait and the rest never does
        Thread writer = new Thread(() -> {
            try {
                Thread.sleep(200);
                coordinator.write(ByteBuffer.wrap(
                        codec.encode(new ValidationResult(1, true, Fingerprint.empty())), 0, 10));
            } catch (InterruptedException | IOException e) {
                throw new IllegalStateException(e);
            }
        });
        long start = System.nanoTime();
        writer.start();

        ValidationOutcome outcome = client.validate(1, 0, Fingerprint.of("x=1"));
        long elapsedMillis = Duration.ofNanos(System.nanoTime() - start).toMillis();
        writer.join();

        assertEquals(ValidationOutcome.FAILED, outcome);
        assertTrue(elapsedMillis < 600, "waited " + elapsedMillis + " ms against a 400 ms bound");
    }

    @Test
    void failedResultInvokesTheDivergenceHandler() throws Exception {
        write(new ValidationResult(3, false, Fingerprint.of("x=1.2")));

        ValidationOutcome outcome = client.validate(3, 0, Fingerprint.of("x=1.1"));

        assertEquals(ValidationOutcome.DIVERGED, outcome);
        DivergenceReport report = divergence.reports().get(0);
        assertEquals(DivergenceReport.Origin.PARTICIPANT, report.origin());
        assertEquals(3, report.syncPoint());
        assertTrue(report.detail().contains("x=1.1"));
        assertTrue(report.detail().contains("x=1.2"));
    }

    @Test
    void missingResultTimesOutWithoutAborting() {
        long start = System.nanoTime();

        assertEquals(ValidationOutcome.TIMED_OUT, client.validate(1, 0, Fingerprint.of("x=1")));

        assertTrue(Duration.ofNanos(System.nanoTime() - start).compareTo(Duration.ofMillis(250)) >= 0);
        assertTrue(divergence.reports().isEmpty());
        assertFalse(client.isClosed());
    }

    @Test
    void interruptDoesNotShortenTheWaitAndIsRestored() {
        long start = System.nanoTime();
        Thread.currentThread().interrupt();

        ValidationOutcome outcome = client.validate(1, 0, Fingerprint.of("x=1"));

        assertTrue(Thread.interrupted(), "interrupt status must be restored");
        assertEquals(ValidationOutcome.TIMED_OUT, outcome);
        assertTrue(Duration.ofNanos(System.nanoTime() - start).compareTo(Duration.ofMillis(250)) >= 0);
    }

    @Test
    void coordinatorCloseFailsTheWait() throws Exception {
        coordinator.close();

        assertEquals(ValidationOutcome.FAILED, client.validate(1, 0, Fingerprint.of("x=1")));
        assertTrue(divergence.reports().isEmpty());
    }

    @Test
    void truncatedResultFailsTheWait() throws Exception {
        coordinator.write(ByteBuffer.wrap(codec.encode(new ValidationResult(1, true, Fingerprint.empty())), 0, 40));
        coordinator.close();

        assertEquals(ValidationOutcome.FAILED, client.validate(1, 0, Fingerprint.of("x=1")));
    }

    @Test
    void shutdownNotifiesTheCoordinatorAndCloses() throws Exception {
        client.shutdown();

        assertEquals(new Shutdown(1), read());
        assertTrue(client.isClosed());
        assertEquals(ValidationOutcome.DISABLED, client.validate(1, 0, Fingerprint.of("x=1")));
        client.shutdown();
    }

    @Test
    void connectGivesUpAfterTheRetryBudget() throws Exception {
        InetSocketAddress nobody;
        try (ServerSocketChannel probe = ServerSocketChannel.open()) {
            probe.bind(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0));
            nobody = (InetSocketAddress) probe.getLocalAddress();
        }

        SetupException e = assertThrows(SetupException.class, () -> ParticipantClient.connect(
                new Participant(0, 1), nobody, FAST, SystemMonotonicClock.INSTANCE, divergence));
        assertNotNull(e.getCause());
    }
}
