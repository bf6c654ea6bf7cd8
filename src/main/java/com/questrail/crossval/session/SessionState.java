package com.questrail.crossval.session;

/**
 * Lifecycle state of a {@link CrossValidationSession}.
 *
 * <pre>
 *   NEW → ACTIVE ⇄ SUSPENDED
 *    │       │         │
 *    └→ DISABLED ←─────┘  (setup failed)
 *   any → CLOSED
 * </pre>
 */
public enum SessionState
{
    NEW,
    ACTIVE,
    SUSPENDED,
    /** Setup failed; {@code validate} is a no-op. {@code initialize} may be retried. */
    DISABLED,
    CLOSED
}
