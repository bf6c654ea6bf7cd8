package com.questrail.crossval.observability;

/**
 * No-op implementation of ValidationObservabilitySink.
 */
public final class NullObservabilitySink implements ValidationObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onPhaseTransition(PhaseTransitionEvent event) {}

    @Override
    public void onRoundResolved(RoundResolvedEvent event) {}

    @Override
    public void onRoundDiscarded(RoundDiscardedEvent event) {}

    @Override
    public void onConnectionEvent(ConnectionEvent event) {}

    @Override
    public void onError(ValidationErrorEvent event) {}
}
