package com.questrail.crossval.model;

/**
 * Orderly departure notice. The coordinator logs it; the connection is left
 * to close on its own.
 */
public record Shutdown(int instanceId) implements ValidationMessage
{
    @Override
    public MessageKind kind() {
        return MessageKind.SHUTDOWN;
    }
}
