package com.questrail.crossval.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly seen by the coordinator.
 *
 * @param cause underlying exception; may be {@code null}
 */
public record ValidationErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
