package com.questrail.crossval.failfast;

/**
 * Reaction to a detected divergence.
 *
 * <p>A divergence is never recoverable: the production handler terminates the
 * process. The seam exists so tests can observe the report instead.</p>
 */
@FunctionalInterface
public interface DivergenceHandler
{
    /**
     * Called at most once per divergence, after diagnostics have been logged.
     * Production implementations do not return.
     */
    void onDivergence(DivergenceReport report);
}
