package com.questrail.crossval.io;

import com.questrail.crossval.codec.ValidationRecordCodec;
import com.questrail.crossval.codec.WireDecodeException;
import com.questrail.crossval.config.ValidationTimingPolicy;
import com.questrail.crossval.model.ValidationMessage;
import com.questrail.crossval.time.Deadline;
import com.questrail.crossval.time.MonotonicClock;

import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.SelectionKey;
import java.nio.channels.Selector;
import java.nio.channels.SocketChannel;
import java.time.Duration;
import java.util.Objects;

/**
 * RecordChannel
 * =============================================================================
 * Reliable whole-record send/receive over a non-blocking {@link SocketChannel}.
 *
 * <h2>Send</h2>
 * {@link #send(ValidationMessage)} returns only after every byte of the record
 * has been handed to the socket. A write that accepts zero bytes (the socket
 * buffer is full) is retried after {@code ioBackoff}; it never spins.
 *
 * <h2>Receive</h2>
 * {@link #receive()} never returns a partial record:
 * <ul>
 *   <li>nothing available and nothing buffered → {@link ReceiveResult.Status#NO_DATA}</li>
 *   <li>end of stream and nothing buffered → {@link ReceiveResult.Status#CLOSED}</li>
 *   <li>end of stream with part of a record buffered → {@link ProtocolViolationException}</li>
 *   <li>part of a record buffered but no more bytes yet → back off and retry,
 *       up to {@code responseTimeout} (or the caller's deadline, if sooner),
 *       then {@link ProtocolViolationException}</li>
 *   <li>any other socket failure → {@link IOException}</li>
 * </ul>
 *
 * <h2>Interrupts</h2>
 * The channel is non-blocking, so a thread interrupt never closes it. An
 * interrupt that lands during a backoff pause is remembered, the operation
 * carries on, and the interrupt status is restored before returning.
 *
 * <h2>Thread Safety</h2>
 * Not thread-safe. One participant thread owns a channel.
 */
public final class RecordChannel implements Closeable
{
    private final SocketChannel channel;
    private final ValidationRecordCodec codec;
    private final ValidationTimingPolicy timing;
    private final MonotonicClock clock;

    private final ByteBuffer inbound = ByteBuffer.allocate(ValidationRecordCodec.RECORD_SIZE);

    private boolean interrupted;

    /**
     * Wraps a connected channel and switches it to non-blocking mode.
     */
    public RecordChannel(SocketChannel channel,
                         ValidationRecordCodec codec,
                         ValidationTimingPolicy timing,
                         MonotonicClock clock) throws IOException {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.timing = Objects.requireNonNull(timing, "timing");
        this.clock = Objects.requireNonNull(clock, "clock");

        this.channel.configureBlocking(false);
    }

    /**
     * Encodes and writes one complete record.
     */
    public void send(ValidationMessage message) throws IOException {
        ByteBuffer out = ByteBuffer.wrap(codec.encode(message));
        try {
            while (out.hasRemaining()) {
                if (channel.write(out) == 0) {
                    backoff();
                }
            }
        } finally {
            restoreInterrupt();
        }
    }

    /**
     * Attempts to read one complete record without waiting for the first byte.
     */
    public ReceiveResult receive() throws IOException {
        return receive(null);
    }

    /**
     * As {@link #receive()}, but a stalled partial record is given up on no
     * later than {@code limit}.
     *
     * @param limit the caller's own deadline; {@code null} for none
     */
    public ReceiveResult receive(Deadline limit) throws IOException {
        Deadline stall = null;
        try {
            while (inbound.hasRemaining()) {
                int n = channel.read(inbound);
                if (n > 0) {
                    continue;
                }
                if (n < 0) {
                    if (inbound.position() == 0) {
                        return ReceiveResult.closed();
                    }
                    int partial = inbound.position();
                    inbound.clear();
                    throw new ProtocolViolationException(
                            "Peer closed after " + partial + " of "
                                    + ValidationRecordCodec.RECORD_SIZE + " record bytes");
                }
                if (inbound.position() == 0) {
                    return ReceiveResult.noData();
                }
                if (stall == null) {
                    stall = stallDeadline(limit);
                }
                else if (stall.hasExpired()) {
                    int partial = inbound.position();
                    inbound.clear();
                    throw new ProtocolViolationException(
                            "Record stalled after " + partial + " of "
                                    + ValidationRecordCodec.RECORD_SIZE + " bytes");
                }
                backoff();
            }

            byte[] record = new byte[ValidationRecordCodec.RECORD_SIZE];
            inbound.flip();
            inbound.get(record);
            inbound.clear();

            try {
                return ReceiveResult.message(codec.decode(record));
            } catch (WireDecodeException e) {
                throw new ProtocolViolationException("Undecodable record: " + e.getMessage(), e);
            }
        } finally {
            restoreInterrupt();
        }
    }

    /**
     * Registers this channel for read readiness with {@code selector}.
     */
    public SelectionKey registerForRead(Selector selector) throws IOException {
        return channel.register(selector, SelectionKey.OP_READ);
    }

    public boolean isOpen() {
        return channel.isOpen();
    }

    @Override
    public void close() throws IOException {
        channel.close();
    }

    private Deadline stallDeadline(Deadline limit) {
        Duration budget = timing.responseTimeout();
        if (limit != null) {
            Duration remaining = Duration.ofNanos(Math.max(0L, limit.remainingNanos()));
            if (remaining.compareTo(budget) < 0) {
                budget = remaining;
            }
        }
        return Deadline.after(budget, clock);
    }

    private void backoff() {
        try {
            Thread.sleep(timing.ioBackoff().toMillis());
        } catch (InterruptedException e) {
            interrupted = true;
        }
    }

    private void restoreInterrupt() {
        if (interrupted) {
            interrupted = false;
            Thread.currentThread().interrupt();
        }
    }
}
