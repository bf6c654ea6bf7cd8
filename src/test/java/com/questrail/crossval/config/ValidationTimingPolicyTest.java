package com.questrail.crossval.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

final class ValidationTimingPolicyTest {

    @Test
    void defaultsMatchDeployedValues() {
        ValidationTimingPolicy p = ValidationTimingPolicy.defaults();

        assertEquals(Duration.ofSeconds(5), p.responseTimeout());
        assertEquals(Duration.ofMillis(100), p.pollSlice());
        assertEquals(Duration.ofMillis(10), p.ioBackoff());
        assertEquals(Duration.ofMillis(100), p.connectRetryDelay());
        assertEquals(50, p.connectAttempts());
        assertEquals(Duration.ofMillis(200), p.initialContactDelay());
        assertEquals(Duration.ofMillis(500), p.resumeSettleDelay());
        assertEquals(Duration.ofSeconds(1), p.abortFlushTimeout());
    }

    @Test
    void copiesChangeOnlyTheNamedFields() {
        ValidationTimingPolicy p = ValidationTimingPolicy.defaults()
                .withResponseTimeout(Duration.ofMillis(250))
                .withDelays(Duration.ZERO, Duration.ofMillis(5));

        assertEquals(Duration.ofMillis(250), p.responseTimeout());
        assertEquals(Duration.ZERO, p.initialContactDelay());
        assertEquals(Duration.ofMillis(5), p.resumeSettleDelay());
        assertEquals(50, p.connectAttempts());
    }

    @Test
    void rejectsUnusableValues() {
        ValidationTimingPolicy d = ValidationTimingPolicy.defaults();

        assertThrows(IllegalArgumentException.class, () -> d.withResponseTimeout(Duration.ofMillis(-1)));
        assertThrows(NullPointerException.class, () -> d.withResponseTimeout(null));
        assertThrows(IllegalArgumentException.class, () -> new ValidationTimingPolicy(
                d.responseTimeout(), Duration.ZERO, d.ioBackoff(), d.connectRetryDelay(),
                d.connectAttempts(), d.initialContactDelay(), d.resumeSettleDelay(), d.abortFlushTimeout()));
        assertThrows(IllegalArgumentException.class, () -> new ValidationTimingPolicy(
                d.responseTimeout(), d.pollSlice(), d.ioBackoff(), d.connectRetryDelay(),
                0, d.initialContactDelay(), d.resumeSettleDelay(), d.abortFlushTimeout()));
    }
}
