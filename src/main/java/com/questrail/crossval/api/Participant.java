package com.questrail.crossval.api;

/**
 * One running instance of the instrumented computation.
 *
 * <p>Instance {@code 0} owns the coordinator role and, in the same process,
 * also acts as an ordinary participant.</p>
 *
 * @param instanceId    this instance, in {@code [0, instanceCount)}
 * @param instanceCount number of cooperating instances, {@code 1..}{@link #MAX_INSTANCES}
 */
public record Participant(int instanceId, int instanceCount) {

    /**
     * Upper bound on cooperating instances. Fixed because the shared-memory
     * segment reserves one slot per instance.
     */
    public static final int MAX_INSTANCES = 4;

    public static final int COORDINATOR_ID = 0;

    public Participant {
        if (instanceCount < 1 || instanceCount > MAX_INSTANCES) {
            throw new IllegalArgumentException(
                    "instanceCount must be in range 1-" + MAX_INSTANCES + " (was " + instanceCount + ")");
        }
        if (instanceId < 0 || instanceId >= instanceCount) {
            throw new IllegalArgumentException(
                    "instanceId must be in range 0-" + (instanceCount - 1) + " (was " + instanceId + ")");
        }
    }

    public boolean isCoordinator() {
        return instanceId == COORDINATOR_ID;
    }
}
