package com.questrail.crossval.io;

import com.questrail.crossval.model.ValidationMessage;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of a single non-blocking receive attempt.
 *
 * <p>The three states are kept distinct because callers react differently:
 * on {@link Status#NO_DATA} the connection stays open, on {@link Status#CLOSED}
 * it is removed, on {@link Status#MESSAGE} the record is dispatched. Real I/O
 * errors are not a status; they propagate as exceptions.</p>
 */
public final class ReceiveResult
{
    public enum Status {
        /** Nothing available right now and nothing buffered. */
        NO_DATA,
        /** Orderly end of stream between records. */
        CLOSED,
        /** One complete record was decoded. */
        MESSAGE
    }

    private static final ReceiveResult NO_DATA = new ReceiveResult(Status.NO_DATA, null);
    private static final ReceiveResult CLOSED = new ReceiveResult(Status.CLOSED, null);

    private final Status status;
    private final ValidationMessage message;

    private ReceiveResult(Status status, ValidationMessage message) {
        this.status = status;
        this.message = message;
    }

    public static ReceiveResult noData() {
        return NO_DATA;
    }

    public static ReceiveResult closed() {
        return CLOSED;
    }

    public static ReceiveResult message(ValidationMessage message) {
        return new ReceiveResult(Status.MESSAGE, Objects.requireNonNull(message, "message"));
    }

    public Status status() {
        return status;
    }

    /**
     * @return the decoded message; empty unless {@link #status()} is {@link Status#MESSAGE}
     */
    public Optional<ValidationMessage> message() {
        return Optional.ofNullable(message);
    }

    @Override
    public String toString() {
        return message == null ? status.name() : status + "[" + message + "]";
    }
}
