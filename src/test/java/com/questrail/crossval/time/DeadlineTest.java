package com.questrail.crossval.time;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

final class DeadlineTest {

    private final ManualMonotonicClock clock = new ManualMonotonicClock();

    @Test
    void expiresOnlyWhenTheBudgetIsSpent() {
        Deadline d = Deadline.after(Duration.ofMillis(300), clock);
        assertFalse(d.hasExpired());

        clock.advanceMillis(299);
        assertFalse(d.hasExpired());

        clock.advanceMillis(1);
        assertTrue(d.hasExpired());
    }

    @Test
    void lastSliceIsClippedToTheRemainder() {
        Deadline d = Deadline.after(Duration.ofMillis(250), clock);

        assertEquals(Duration.ofMillis(100), d.nextSlice(Duration.ofMillis(100)));
        clock.advanceMillis(200);
        assertEquals(Duration.ofMillis(50), d.nextSlice(Duration.ofMillis(100)));
        clock.advanceMillis(80);
        assertEquals(Duration.ZERO, d.nextSlice(Duration.ofMillis(100)));
        assertTrue(d.remainingNanos() < 0);
    }

    @Test
    void shortSlicesDoNotStretchTheWait() {
        Deadline d = Deadline.after(Duration.ofMillis(100), clock);
        int slices = 0;
        while (!d.hasExpired()) {
            // every slice ends early
            clock.advanceMillis(Math.max(1, d.nextSlice(Duration.ofMillis(30)).toMillis() / 3));
            slices++;
        }
        assertEquals(0, d.nextSlice(Duration.ofMillis(30)).toNanos());
        assertTrue(slices > 3);
    }

    @Test
    void zeroTimeoutIsAlreadyExpired() {
        assertTrue(Deadline.after(Duration.ZERO, clock).hasExpired());
        assertThrows(IllegalArgumentException.class, () -> Deadline.after(Duration.ofMillis(-1), clock));
    }
}
