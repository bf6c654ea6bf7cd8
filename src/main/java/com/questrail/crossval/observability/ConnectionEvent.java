package com.questrail.crossval.observability;

import java.time.Instant;

/**
 * Record representing a change in one participant connection.
 *
 * @param connectionId endpoint-assigned identity of the connection
 * @param instanceId   registered instance, or {@link #UNREGISTERED}
 */
public record ConnectionEvent(
    Instant timestamp,
    Kind kind,
    Object connectionId,
    int instanceId
) {
    public static final int UNREGISTERED = -1;

    public enum Kind {
        OPENED,
        REGISTERED,
        SHUTDOWN_RECEIVED,
        CLOSED
    }
}
