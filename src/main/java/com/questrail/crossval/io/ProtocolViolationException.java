package com.questrail.crossval.io;

import java.io.IOException;

/**
 * A peer broke the record protocol in a way that can never be repaired on
 * this connection: the stream ended inside a record, a record stalled part
 * way through, or a complete record could not be decoded.
 *
 * <p>The connection is dropped; the process carries on.</p>
 */
public class ProtocolViolationException extends IOException
{
    public ProtocolViolationException(String message) {
        super(message);
    }

    public ProtocolViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
