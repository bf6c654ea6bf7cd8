package com.questrail.crossval.transport;

/**
 * Endpoint-assigned identity of one accepted stream connection.
 *
 * <p>Identities are never reused within the lifetime of an endpoint.</p>
 */
public record ConnectionId(long value) {

    @Override
    public String toString() {
        return "conn-" + value;
    }
}
