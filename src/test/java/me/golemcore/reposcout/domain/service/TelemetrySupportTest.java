package me.golemcore.reposcout.domain.service;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TelemetrySupportTest {

    @Test
    void shouldProduceStableShortHash() {
        String hash = TelemetrySupport.shortHash("breadth|precision");

        assertEquals(16, hash.length());
        assertTrue(hash.matches("[0-9a-f]{16}"));
        assertEquals(hash, TelemetrySupport.shortHash("breadth|precision"));
        assertEquals(hash, TelemetrySupport.shortHash("  breadth|precision  "));
    }

    @Test
    void shouldReturnPlaceholderForBlankInput() {
        assertEquals("na", TelemetrySupport.shortHash(null));
        assertEquals("na", TelemetrySupport.shortHash("  "));
    }

    @Test
    void shouldKeepFingerprintPartsDistinct() {
        assertNotEquals(TelemetrySupport.fingerprint("ab", "c"), TelemetrySupport.fingerprint("a", "bc"));
        assertEquals(TelemetrySupport.fingerprint("ab", "c"), TelemetrySupport.fingerprint("ab", "c"));
    }
}
