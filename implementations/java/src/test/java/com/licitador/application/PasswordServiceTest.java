package com.licitador.application;

import com.licitador.infrastructure.crypto.ChaChaCryptoService;
import com.licitador.infrastructure.crypto.CipherDecryptException;
import com.licitador.infrastructure.crypto.CipherEncryptException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PasswordServiceTest {

    private static final String MASTER_KEY = "AAECAwQFBgcICQoLDA0ODxAREhMUFRYXGBkaGxwdHh8=";

    private PasswordService passwordService;

    @BeforeEach
    void setUp() {
        passwordService = new PasswordService(new EncryptionService(new ChaChaCryptoService(MASTER_KEY)));
    }

    @Test
    void hashIsNotThePassword() {
        String hash = passwordService.hashPassword("S3cure!pass");

        assertNotEquals("S3cure!pass", hash);
    }

    @Test
    void correctPasswordVerifies() {
        String hash = passwordService.hashPassword("S3cure!pass");

        assertTrue(passwordService.verifyPassword("S3cure!pass", hash));
    }

    @Test
    void wrongPasswordDoesNotVerify() {
        String hash = passwordService.hashPassword("S3cure!pass");

        assertFalse(passwordService.verifyPassword("s3cure!pass", hash));
        assertFalse(passwordService.verifyPassword("", hash));
        assertFalse(passwordService.verifyPassword(null, hash));
    }

    @Test
    void emptyPasswordCannotBeHashed() {
        assertThrows(CipherEncryptException.class, () -> passwordService.hashPassword(""));
    }

    @Test
    void corruptHashIsAnError() {
        assertThrows(CipherDecryptException.class, () -> passwordService.verifyPassword("x", "AAAA"));
    }
}
