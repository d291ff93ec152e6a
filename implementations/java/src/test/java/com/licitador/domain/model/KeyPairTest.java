package com.licitador.domain.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class KeyPairTest {

    private static final Instant ISSUED = Instant.parse("2026-03-02T10:00:00Z");

    @Test
    void issuedPairIsActiveUnusedAndExpiresAfterValidity() {
        KeyPair keyPair = KeyPair.issue(UUID.randomUUID(), "pub", "priv", ISSUED, Duration.ofMinutes(30));

        assertTrue(keyPair.isActive());
        assertFalse(keyPair.isUsed());
        assertEquals(ISSUED.plusSeconds(1800), keyPair.getExpiresAt());
        assertTrue(keyPair.isUsableAt(ISSUED.plusSeconds(1799)));
    }

    @Test
    void pairIsExpiredFromItsExpiryInstant() {
        KeyPair keyPair = KeyPair.issue(UUID.randomUUID(), "pub", "priv", ISSUED, Duration.ofMinutes(30));

        assertTrue(keyPair.isExpiredAt(keyPair.getExpiresAt()));
        assertFalse(keyPair.isUsableAt(keyPair.getExpiresAt()));
    }

    @Test
    void usedPairIsNotUsable() {
        KeyPair keyPair = KeyPair.reconstitute(UUID.randomUUID(), "pub", "priv",
            true, ISSUED, ISSUED.plusSeconds(60), ISSUED.plusSeconds(1));

        assertTrue(keyPair.isUsed());
        assertFalse(keyPair.isUsableAt(ISSUED.plusSeconds(2)));
    }

    @Test
    void nonPositiveValidityIsRejected() {
        UUID id = UUID.randomUUID();

        assertThrows(IllegalArgumentException.class,
            () -> KeyPair.issue(id, "pub", "priv", ISSUED, Duration.ZERO));
        assertThrows(IllegalArgumentException.class,
            () -> KeyPair.issue(id, "pub", "priv", ISSUED, Duration.ofMinutes(-1)));
    }

    @Test
    void toStringDoesNotExposeKeys() {
        KeyPair keyPair = KeyPair.issue(UUID.randomUUID(), "PUBLIC-MATERIAL", "PRIVATE-MATERIAL",
            ISSUED, Duration.ofMinutes(30));

        assertFalse(keyPair.toString().contains("PRIVATE-MATERIAL"));
    }
}
