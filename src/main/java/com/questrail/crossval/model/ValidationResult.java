package com.questrail.crossval.model;

import com.questrail.crossval.api.Fingerprint;

import java.util.Objects;

/**
 * Outcome of a resolved barrier round, sent by the coordinator to every
 * participant that reported in that round.
 *
 * <p>
 * With exactly two participants the coordinator also sends the <em>other</em>
 * participant's fingerprint so the receiver can print it next to its own.
 * Otherwise {@code peerFingerprint} is empty.
 * </p>
 */
public record ValidationResult(
        int syncPoint,
        boolean passed,
        Fingerprint peerFingerprint
) implements ValidationMessage
{
    public ValidationResult {
        Objects.requireNonNull(peerFingerprint, "peerFingerprint");
    }

    @Override
    public MessageKind kind() {
        return MessageKind.VALIDATION_RESULT;
    }
}
