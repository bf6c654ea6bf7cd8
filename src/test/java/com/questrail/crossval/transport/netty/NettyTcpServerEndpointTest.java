package com.questrail.crossval.transport.netty;

import com.questrail.crossval.api.Fingerprint;
import com.questrail.crossval.codec.ValidationRecordCodec;
import com.questrail.crossval.io.ProtocolViolationException;
import com.questrail.crossval.model.RegisterInstance;
import com.questrail.crossval.model.ValidationResult;
import com.questrail.crossval.transport.ConnectionId;
import com.questrail.crossval.transport.StreamServerListener;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.SocketChannel;
import java.util.Arrays;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * NettyTcpServerEndpointTest
 * -----------------------------------------------------------------------------
 * End-to-end over loopback: framing, outbound writes and close reporting.
 */
final class NettyTcpServerEndpointTest {

    private final ValidationRecordCodec codec = new ValidationRecordCodec();
    private final RecordingListener listener = new RecordingListener();

    private NettyTcpServerEndpoint endpoint;
    private InetSocketAddress bound;

    sealed interface Event permits Opened, Record, Closed {}
    record Opened(ConnectionId connection, String thread) implements Event {}
    record Record(ConnectionId connection, byte[] bytes) implements Event {}
    record Closed(ConnectionId connection, Throwable cause) implements Event {}

    static final class RecordingListener implements StreamServerListener {
        final BlockingQueue<Event> events = new LinkedBlockingQueue<>();

        @Override
        public void onConnectionOpened(ConnectionId connection) {
            events.add(new Opened(connection, Thread.currentThread().getName()));
        }

        @Override
        public void onRecord(ConnectionId connection, byte[] record) {
            events.add(new Record(connection, record));
        }

        @Override
        public void onConnectionClosed(ConnectionId connection, Throwable cause) {
            events.add(new Closed(connection, cause));
        }

        <T extends Event> T next(Class<T> type) throws InterruptedException {
            Event e = events.poll(5, TimeUnit.SECONDS);
            assertNotNull(e, "timed out waiting for " + type.getSimpleName());
            return assertInstanceOf(type, e);
        }
    }

    @BeforeEach
    void start() throws Exception {
        endpoint = new NettyTcpServerEndpoint(
                new InetSocketAddress(InetAddress.getLoopbackAddress(), 0),
                ValidationRecordCodec.RECORD_SIZE);
        endpoint.setListener(listener);
        bound = endpoint.start();
    }

    @AfterEach
    void stop() {
        endpoint.stop();
    }

    @Test
    void startReportsTheResolvedPort() {
        assertTrue(bound.getPort() > 0);
    }

    @Test
    void recordSplitAcrossWritesIsDeliveredWhole() throws Exception {
        try (SocketChannel client = SocketChannel.open(bound)) {
            Opened opened = listener.next(Opened.class);
            assertTrue(opened.thread().startsWith(NettyTcpServerEndpoint.THREAD_NAME));

            byte[] record = codec.encode(new RegisterInstance(2));
            client.write(ByteBuffer.wrap(record, 0, 300));
            Thread.sleep(50);
            client.write(ByteBuffer.wrap(record, 300, record.length - 300));

            Record r = listener.next(Record.class);
            assertEquals(opened.connection(), r.connection());
            assertEquals(new RegisterInstance(2), codec.decode(r.bytes()));
        }
        assertNull(listener.next(Closed.class).cause());
    }

    @Test
    void twoRecordsInOneWriteArriveInOrder() throws Exception {
        try (SocketChannel client = SocketChannel.open(bound)) {
            listener.next(Opened.class);

            byte[] a = codec.encode(new RegisterInstance(0));
            byte[] b = codec.encode(new RegisterInstance(1));
            byte[] both = Arrays.copyOf(a, a.length + b.length);
            System.arraycopy(b, 0, both, a.length, b.length);
            ByteBuffer out = ByteBuffer.wrap(both);
            while (out.hasRemaining()) {
                client.write(out);
            }

            assertEquals(new RegisterInstance(0), codec.decode(listener.next(Record.class).bytes()));
            assertEquals(new RegisterInstance(1), codec.decode(listener.next(Record.class).bytes()));
        }
    }

    @Test
    void sendReachesTheClient() throws Exception {
        try (SocketChannel client = SocketChannel.open(bound)) {
            ConnectionId id = listener.next(Opened.class).connection();

            ValidationResult result = new ValidationResult(7, true, Fingerprint.of("x=1"));
            endpoint.send(id, codec.encode(result)).toCompletableFuture().get(5, TimeUnit.SECONDS);

            ByteBuffer in = ByteBuffer.allocate(ValidationRecordCodec.RECORD_SIZE);
            while (in.hasRemaining()) {
                assertTrue(client.read(in) >= 0);
            }
            assertEquals(result, codec.decode(in.array()));
        }
    }

    @Test
    void sendToUnknownConnectionFails() {
        assertTrue(endpoint.send(new ConnectionId(999), new byte[ValidationRecordCodec.RECORD_SIZE])
                .toCompletableFuture().isCompletedExceptionally());
    }

    @Test
    void closeMidRecordIsReportedAsProtocolViolation() throws Exception {
        try (SocketChannel client = SocketChannel.open(bound)) {
            listener.next(Opened.class);
            client.write(ByteBuffer.wrap(codec.encode(new RegisterInstance(0)), 0, 20));
        }

        Closed closed = listener.next(Closed.class);
        assertInstanceOf(ProtocolViolationException.class, closed.cause());
    }

    @Test
    void closeByEndpointIsReported() throws Exception {
        try (SocketChannel client = SocketChannel.open(bound)) {
            ConnectionId id = listener.next(Opened.class).connection();

            endpoint.close(id);

            assertEquals(id, listener.next(Closed.class).connection());
            assertEquals(-1, client.read(ByteBuffer.allocate(1)));
        }
    }

    @Test
    void stopClosesClientsWithoutCallbacks() throws Exception {
        try (SocketChannel client = SocketChannel.open(bound)) {
            listener.next(Opened.class);

            endpoint.stop();

            assertEquals(-1, client.read(ByteBuffer.allocate(1)));
            assertNull(listener.events.poll(200, TimeUnit.MILLISECONDS));
        }
    }

    @Test
    void bindConflictIsASetupFailure() {
        NettyTcpServerEndpoint second = new NettyTcpServerEndpoint(bound, ValidationRecordCodec.RECORD_SIZE);
        second.setListener(listener);
        try {
            assertThrows(com.questrail.crossval.api.SetupException.class, second::start);
        } finally {
            second.stop();
        }
    }
}
