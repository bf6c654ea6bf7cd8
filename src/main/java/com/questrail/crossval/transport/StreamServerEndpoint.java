package com.questrail.crossval.transport;

import com.questrail.crossval.api.SetupException;

import java.net.InetSocketAddress;
import java.util.concurrent.CompletionStage;

/**
 * StreamServerEndpoint
 * -----------------------------------------------------------------------------
 * Minimal port for a listening, connection-oriented record transport.
 *
 * <p>The endpoint accepts connections, frames inbound bytes into whole
 * fixed-size records and writes outbound records. It does not decode records
 * and knows nothing about registration or barrier rounds; the coordinator does.</p>
 *
 * <p>Implementations may be backed by Netty or a test harness.</p>
 */
public interface StreamServerEndpoint
{
    /**
     * Register the listener that receives connection lifecycle and records.
     *
     * <p>This must be called before {@link #start()}.</p>
     */
    void setListener(StreamServerListener listener);

    /**
     * Bind and begin accepting connections. Returns once the endpoint is listening.
     *
     * @return the address actually bound (the port is resolved if 0 was requested)
     * @throws SetupException if the address cannot be bound
     */
    InetSocketAddress start() throws SetupException;

    /**
     * Close every connection and the listening socket without draining.
     *
     * <p>Connections closed by {@code stop()} are not reported to the listener.
     * Idempotent.</p>
     */
    void stop();

    /**
     * Write one complete record to a connection.
     *
     * @return a stage that completes when the record has been handed to the
     *         socket, or completes exceptionally if the write failed or the
     *         connection is unknown
     */
    CompletionStage<Void> send(ConnectionId connection, byte[] record);

    /**
     * Close one connection. Its closure is reported to the listener as usual.
     */
    void close(ConnectionId connection);
}
