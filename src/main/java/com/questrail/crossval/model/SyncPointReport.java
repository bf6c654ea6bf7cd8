package com.questrail.crossval.model;

import com.questrail.crossval.api.Fingerprint;

import java.util.Objects;

/**
 * A participant's fingerprint for one sync point.
 *
 * <p>
 * {@code syncPoint} is the per-session sequence number that keys the barrier
 * round. {@code pointOrdinal} names the instrumented location and is carried
 * for diagnostics only.
 * </p>
 *
 * @param instanceId   reporting instance
 * @param syncPoint    barrier key
 * @param pointOrdinal ordinal of the instrumented location
 * @param fingerprint  formatted state snapshot
 */
public record SyncPointReport(
        int instanceId,
        int syncPoint,
        int pointOrdinal,
        Fingerprint fingerprint
) implements ValidationMessage
{
    public SyncPointReport {
        Objects.requireNonNull(fingerprint, "fingerprint");
    }

    @Override
    public MessageKind kind() {
        return MessageKind.SYNC_POINT;
    }
}
