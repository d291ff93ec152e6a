package com.licitador.infrastructure.crypto;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Base64;

import static org.junit.jupiter.api.Assertions.*;

class DeterministicAesCryptoServiceTest {

    private static final String ENCRYPTION_KEY = "ICEiIyQlJicoKSorLC0uLzAxMjM0NTY3ODk6Ozw9Pj8=";
    private static final String IV_KEY = "QEFCQ0RFRkdISUpLTE1OT1BRUlNUVVZXWFlaW1xdXl8=";
    private static final String OTHER_KEY = "AAECAwQFBgcICQoLDA0ODxAREhMUFRYXGBkaGxwdHh8=";

    private DeterministicAesCryptoService cryptoService;

    @BeforeEach
    void setUp() {
        cryptoService = new DeterministicAesCryptoService(ENCRYPTION_KEY, IV_KEY);
    }

    @AfterEach
    void tearDown() {
        cryptoService.close();
    }

    @Test
    void encryptionIsDeterministic() {
        assertEquals(cryptoService.encrypt("12345678-Z"), cryptoService.encrypt("12345678-Z"));
    }

    @Test
    void differentPlaintextsGiveDifferentCiphertexts() {
        assertNotEquals(cryptoService.encrypt("A12345678"), cryptoService.encrypt("B12345678"));
    }

    @Test
    void decryptReturnsOriginalText() {
        String ciphertext = cryptoService.encrypt("Licitación Pública Nº 42");

        assertEquals("Licitación Pública Nº 42", cryptoService.decrypt(ciphertext));
    }

    @Test
    void envelopeIsIvTagThenPaddedCiphertext() {
        byte[] envelope = Base64.getDecoder().decode(cryptoService.encrypt("abc"));

        // one padded AES block after iv(16) and tag(32)
        assertEquals(16 + 32 + 16, envelope.length);
    }

    @Test
    void fullBlockPlaintextGetsExtraPaddingBlock() {
        byte[] envelope = Base64.getDecoder().decode(cryptoService.encrypt("0123456789abcdef"));

        assertEquals(16 + 32 + 32, envelope.length);
    }

    @Test
    void nullOrEmptyPlaintextIsRejected() {
        CipherEncryptException ex = assertThrows(CipherEncryptException.class, () -> cryptoService.encrypt(""));
        assertEquals("The plaintext cannot be null or empty", ex.getMessage());

        assertThrows(CipherEncryptException.class, () -> cryptoService.encrypt(null));
    }

    @Test
    void nullOrEmptyCiphertextIsRejected() {
        assertThrows(CipherDecryptException.class, () -> cryptoService.decrypt(""));
        assertThrows(CipherDecryptException.class, () -> cryptoService.decrypt(null));
    }

    @Test
    void invalidBase64IsRejected() {
        assertThrows(CipherDecryptException.class, () -> cryptoService.decrypt("%%%"));
    }

    @Test
    void envelopeOfExactlyHeaderSizeIsRejected() {
        String headerOnly = Base64.getEncoder().encodeToString(new byte[48]);

        CipherDecryptException ex = assertThrows(CipherDecryptException.class,
            () -> cryptoService.decrypt(headerOnly));

        assertTrue(ex.getMessage().contains("too short"));
    }

    @Test
    void tamperedCiphertextFailsAuthentication() {
        byte[] envelope = Base64.getDecoder().decode(cryptoService.encrypt("tamper me"));
        envelope[envelope.length - 1] ^= 0x01;

        assertThrows(AuthenticationFailedException.class,
            () -> cryptoService.decrypt(Base64.getEncoder().encodeToString(envelope)));
    }

    @Test
    void tamperedIvFailsAuthentication() {
        byte[] envelope = Base64.getDecoder().decode(cryptoService.encrypt("tamper me"));
        envelope[0] ^= 0x01;

        assertThrows(AuthenticationFailedException.class,
            () -> cryptoService.decrypt(Base64.getEncoder().encodeToString(envelope)));
    }

    @Test
    void ciphertextFromDifferentEncryptionKeyFailsAuthentication() {
        try (DeterministicAesCryptoService other = new DeterministicAesCryptoService(OTHER_KEY, IV_KEY)) {
            String foreign = other.encrypt("foreign");

            assertThrows(AuthenticationFailedException.class, () -> cryptoService.decrypt(foreign));
        }
    }

    @Test
    void invalidKeysAreReportedByName() {
        InvalidKeyConfigurationException encryptionKey = assertThrows(InvalidKeyConfigurationException.class,
            () -> new DeterministicAesCryptoService("", IV_KEY));
        assertTrue(encryptionKey.getMessage().contains("Encryption key"));

        InvalidKeyConfigurationException ivKey = assertThrows(InvalidKeyConfigurationException.class,
            () -> new DeterministicAesCryptoService(ENCRYPTION_KEY, "AAECAwQFBgcICQoLDA0ODw=="));
        assertTrue(ivKey.getMessage().contains("IV generation key"));
        assertTrue(ivKey.getMessage().contains("32 bytes"));
    }

    @Test
    void closedServiceRefusesWork() {
        String ciphertext = cryptoService.encrypt("before close");

        cryptoService.close();
        cryptoService.close();

        assertThrows(IllegalStateException.class, () -> cryptoService.encrypt("after close"));
        assertThrows(IllegalStateException.class, () -> cryptoService.decrypt(ciphertext));
    }
}
