package com.questrail.crossval.api;

/**
 * SyncPointId
 * -----------------------------------------------------------------------------
 * Identifies a named location in the instrumented program at which all
 * participants compare fingerprints.
 *
 * <p>The set of locations belongs to the simulation, not to this library, so
 * the identifier is an interface meant to be implemented by an {@code enum}.
 * The set is fixed and small; new locations are appended so that existing
 * ordinals keep their meaning across all participants of a run.</p>
 *
 * Example:
 * <pre>{@code
 * enum WaterSyncPoint implements SyncPointId {
 *     WORKSTART_BEGIN,
 *     INTRAF_BARRIER_INIT,
 *     INTERF_FORCES_STEP_1
 * }
 * }</pre>
 *
 * <p>The ordinal is carried on the wire for diagnostics only. The barrier is
 * keyed on a per-session call sequence (see {@code SyncPointSequencer}), so
 * two calls to the same location in one run are still distinct rounds.</p>
 */
public interface SyncPointId
{
    /**
     * @return the position of this location in its enumeration
     */
    int ordinal();

    /**
     * @return a human-readable name for logs
     */
    String name();
}
