package com.questrail.crossval.api;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

final class FingerprintTest {

    @Test
    void formatUsesRootLocale() {
        Fingerprint fp = Fingerprint.format("step=%d pot=%.3f", 3, -12.5);
        assertEquals("step=3 pot=-12.500", fp.text());
    }

    @Test
    void longTextIsTruncatedToTheFieldBound() {
        Fingerprint fp = Fingerprint.of("x".repeat(400));
        assertEquals(Fingerprint.MAX_BYTES, fp.text().length());
    }

    @Test
    void truncationNeverSplitsAMultiByteCharacter() {
        // 254 ASCII bytes + a 2-byte character would need 256 bytes
        Fingerprint fp = Fingerprint.of("a".repeat(254) + "é");
        byte[] utf8 = fp.text().getBytes(StandardCharsets.UTF_8);

        assertEquals(254, utf8.length);
        assertFalse(fp.text().endsWith("é"));
    }

    @Test
    void nulIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> Fingerprint.of("a\0b"));
    }

    @Test
    void equalityIsByText() {
        assertEquals(Fingerprint.of("a=1"), Fingerprint.format("a=%d", 1));
        assertTrue(Fingerprint.of("").isEmpty());
    }
}
