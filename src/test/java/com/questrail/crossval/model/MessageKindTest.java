package com.questrail.crossval.model;

import com.questrail.crossval.api.Fingerprint;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class MessageKindTest {

    @Test
    void codesAreStableAndResolvable() {
        assertEquals(1, MessageKind.REGISTER_INSTANCE.code());
        assertEquals(2, MessageKind.SYNC_POINT.code());
        assertEquals(3, MessageKind.VALIDATION_RESULT.code());
        assertEquals(4, MessageKind.SHUTDOWN.code());

        for (MessageKind kind : MessageKind.values()) {
            assertSame(kind, MessageKind.fromCode(kind.code()));
        }
    }

    @Test
    void unknownCodeIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> MessageKind.fromCode(0));
        assertThrows(IllegalArgumentException.class, () -> MessageKind.fromCode(5));
    }

    @Test
    void everyMessageReportsItsKind() {
        assertEquals(MessageKind.REGISTER_INSTANCE, new RegisterInstance(0).kind());
        assertEquals(MessageKind.SYNC_POINT, new SyncPointReport(0, 1, 0, Fingerprint.of("x=1")).kind());
        assertEquals(MessageKind.VALIDATION_RESULT, new ValidationResult(1, true, Fingerprint.empty()).kind());
        assertEquals(MessageKind.SHUTDOWN, new Shutdown(0).kind());
    }

    @Test
    void textFieldsAreRequired() {
        assertThrows(NullPointerException.class, () -> new SyncPointReport(0, 1, 0, null));
        assertThrows(NullPointerException.class, () -> new ValidationResult(1, false, null));
    }
}
