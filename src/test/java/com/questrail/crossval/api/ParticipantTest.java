package com.questrail.crossval.api;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class ParticipantTest {

    @Test
    void instanceZeroIsTheCoordinator() {
        assertTrue(new Participant(0, 2).isCoordinator());
        assertFalse(new Participant(1, 2).isCoordinator());
    }

    @Test
    void rejectsCountsOutsideTheSupportedRange() {
        assertThrows(IllegalArgumentException.class, () -> new Participant(0, 0));
        assertThrows(IllegalArgumentException.class, () -> new Participant(0, Participant.MAX_INSTANCES + 1));
    }

    @Test
    void rejectsIdsOutsideTheInstanceCount() {
        assertThrows(IllegalArgumentException.class, () -> new Participant(2, 2));
        assertThrows(IllegalArgumentException.class, () -> new Participant(-1, 2));
    }
}
