package com.questrail.crossval.codec;

/**
 * Indicates that a complete, fixed-size record could not be translated into
 * a valid {@link com.questrail.crossval.model.ValidationMessage}.
 *
 * This typically reflects:
 * <ul>
 *   <li>Unknown kind code</li>
 *   <li>A text field without its NUL terminator</li>
 *   <li>A text field that is not valid UTF-8</li>
 * </ul>
 */
public final class WireDecodeException extends RuntimeException
{
    public WireDecodeException(String message) {
        super(message);
    }

    public WireDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
