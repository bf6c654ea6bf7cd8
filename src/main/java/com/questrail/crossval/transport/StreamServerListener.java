package com.questrail.crossval.transport;

/**
 * StreamServerListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link StreamServerEndpoint}.
 *
 * <p>All callbacks are delivered serially on one thread. The Netty endpoint
 * delivers them on its single event-loop thread, which is what lets the
 * coordinator keep its state without locks.</p>
 */
public interface StreamServerListener
{
    /**
     * Called when a connection is accepted.
     */
    void onConnectionOpened(ConnectionId connection);

    /**
     * Called for every complete inbound record, in arrival order.
     *
     * @param record exactly one fixed-size record; never a partial one
     */
    void onRecord(ConnectionId connection, byte[] record);

    /**
     * Called once when a connection ends.
     *
     * @param cause {@code null} for an orderly close between records; a
     *              {@link com.questrail.crossval.io.ProtocolViolationException}
     *              if the peer closed mid-record; otherwise the I/O failure
     */
    void onConnectionClosed(ConnectionId connection, Throwable cause);
}
