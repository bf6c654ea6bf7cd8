package com.questrail.crossval.observability;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements ValidationObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onPhaseTransition(PhaseTransitionEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onRoundResolved(RoundResolvedEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onRoundDiscarded(RoundDiscardedEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onConnectionEvent(ConnectionEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onError(ValidationErrorEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized <T> List<T> eventsOfType(Class<T> type) {
        return events.stream()
            .filter(type::isInstance)
            .map(type::cast)
            .collect(Collectors.toList());
    }

    public synchronized <T> boolean hasEventOfType(Class<T> type) {
        return events.stream().anyMatch(type::isInstance);
    }
}
