package com.questrail.crossval.model;

/**
 * Registration request.
 *
 * <p>
 * First message on every participant connection. Binds the connection to
 * {@code instanceId} on the coordinator so that results can be routed back.
 * </p>
 */
public record RegisterInstance(int instanceId) implements ValidationMessage
{
    @Override
    public MessageKind kind() {
        return MessageKind.REGISTER_INSTANCE;
    }
}
