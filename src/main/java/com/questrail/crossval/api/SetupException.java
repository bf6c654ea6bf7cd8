package com.questrail.crossval.api;

/**
 * Raised when a transport cannot be brought up: the coordinator cannot bind,
 * a participant cannot reach the coordinator within its retry budget, or the
 * shared segment cannot be created or opened.
 *
 * <p>Setup failures are never fatal to the process. The session logs them and
 * leaves validation disabled.</p>
 */
public class SetupException extends Exception
{
    public SetupException(String message) {
        super(message);
    }

    public SetupException(String message, Throwable cause) {
        super(message, cause);
    }
}
