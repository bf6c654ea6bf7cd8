package com.questrail.crossval.session;

import com.questrail.crossval.api.Fingerprint;
import com.questrail.crossval.api.ValidationOutcome;
import com.questrail.crossval.client.ParticipantClient;
import com.questrail.crossval.coordinator.ValidationCoordinator;

/**
 * Socket transport: this instance's client connection plus, on instance 0,
 * the coordinator it hosts.
 */
final class SocketValidationEngine implements ValidationEngine
{
    private final ValidationCoordinator coordinator;
    private final ParticipantClient client;

    /**
     * @param coordinator hosted coordinator; {@code null} on every instance but 0
     */
    SocketValidationEngine(ValidationCoordinator coordinator, ParticipantClient client) {
        this.coordinator = coordinator;
        this.client = client;
    }

    @Override
    public ValidationOutcome validate(int syncPoint, int pointOrdinal, Fingerprint fingerprint) {
        return client.validate(syncPoint, pointOrdinal, fingerprint);
    }

    @Override
    public boolean validationFailed() {
        // mismatches are acted on by the coordinator and the client as they arrive
        return false;
    }

    @Override
    public String mismatchDetail() {
        return "";
    }

    @Override
    public void abandon() {
        client.close();
        if (coordinator != null) {
            coordinator.shutdown();
        }
    }

    @Override
    public void shutdown() {
        client.shutdown();
        if (coordinator != null) {
            coordinator.shutdown();
        }
    }
}
