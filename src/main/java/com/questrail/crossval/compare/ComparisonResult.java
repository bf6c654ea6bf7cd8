package com.questrail.crossval.compare;

import java.util.Objects;

/**
 * Outcome of comparing one fingerprint against a reference.
 *
 * @param matched {@code true} if the fingerprints agree within tolerance
 * @param detail  human-readable description of the mismatch; empty on match
 */
public record ComparisonResult(boolean matched, String detail) {

    private static final ComparisonResult MATCH = new ComparisonResult(true, "");

    public ComparisonResult {
        Objects.requireNonNull(detail, "detail");
    }

    public static ComparisonResult match() {
        return MATCH;
    }

    public static ComparisonResult mismatch(String detail) {
        return new ComparisonResult(false, detail);
    }
}
