package com.questrail.crossval.observability;

import com.questrail.crossval.barrier.Arrival;
import com.questrail.crossval.barrier.BarrierOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of ValidationObservabilitySink that emits logs via SLF4J.
 *
 * <p>A mismatch logs every arrival's fingerprint at ERROR so the divergence can be
 * diagnosed from the coordinator's log alone.</p>
 */
public final class Slf4jValidationObservabilitySink implements ValidationObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jValidationObservabilitySink.class);

    @Override
    public void onPhaseTransition(PhaseTransitionEvent event) {
        log.info("Coordinator phase: {} -> {}", event.from(), event.to());
    }

    @Override
    public void onRoundResolved(RoundResolvedEvent event) {
        BarrierOutcome outcome = event.outcome();
        if (outcome instanceof BarrierOutcome.Match m) {
            log.debug("Sync point {} validated across {} instances", m.syncPoint(), m.arrivals().size());
        }
        else if (outcome instanceof BarrierOutcome.Mismatch m) {
            log.error("VALIDATION FAILED at sync point {}: {}", m.syncPoint(), m.detail());
            for (Arrival a : m.arrivals()) {
                log.error("  Instance {}: '{}'", a.instanceId(), a.fingerprint().text());
            }
        }
    }

    @Override
    public void onRoundDiscarded(RoundDiscardedEvent event) {
        log.warn("Sync point {} abandoned by report for sync point {}; dropped instances {}",
            event.discardedSyncPoint(),
            event.newSyncPoint(),
            event.discarded().stream().map(Arrival::instanceId).toList());
    }

    @Override
    public void onConnectionEvent(ConnectionEvent event) {
        if (event.kind() == ConnectionEvent.Kind.OPENED) {
            log.debug("Connection {} accepted", event.connectionId());
        }
        else {
            log.info("Connection {} (instance {}): {}", event.connectionId(), event.instanceId(), event.kind());
        }
    }

    @Override
    public void onError(ValidationErrorEvent event) {
        log.error("Cross-validation error: {}", event.message(), event.cause());
    }
}
