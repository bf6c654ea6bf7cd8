package com.questrail.crossval.observability;

/**
 * Main interface for receiving coordinator observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>All callbacks arrive on the coordinator's event-loop thread and must not block.</p>
 */
public interface ValidationObservabilitySink {
    /**
     * Called when the coordinator moves between lifecycle phases.
     * @param event the transition
     */
    void onPhaseTransition(PhaseTransitionEvent event);

    /**
     * Called when a barrier round resolves, with either outcome.
     * @param event the resolved round
     */
    void onRoundResolved(RoundResolvedEvent event);

    /**
     * Called when a partially filled round is dropped because a report for
     * another sync point arrived.
     * @param event the dropped arrivals
     */
    void onRoundDiscarded(RoundDiscardedEvent event);

    /**
     * Called when a participant connection opens, registers, announces shutdown or closes.
     * @param event the connection event
     */
    void onConnectionEvent(ConnectionEvent event);

    /**
     * Called when an error or anomaly occurs (protocol violation, peer loss during registration).
     * @param event the error event
     */
    void onError(ValidationErrorEvent event);
}
