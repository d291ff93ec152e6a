package com.licitador.application;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Password protection on top of {@link EncryptionService}.
 *
 * <p>Stored values are reversible ChaCha20-Poly1305 envelopes, not one-way
 * hashes; anyone holding the master key can recover the password.
 */
@Service
@RequiredArgsConstructor
public class PasswordService {

    private final EncryptionService encryptionService;

    public String hashPassword(String password) {
        return encryptionService.encrypt(password);
    }

    /**
     * @param password candidate password as typed
     * @param passwordHash value previously returned by {@link #hashPassword(String)}
     * @return whether the stored value decrypts to {@code password}
     * @throws com.licitador.infrastructure.crypto.CipherDecryptException if the stored value is corrupt
     */
    public boolean verifyPassword(String password, String passwordHash) {
        String stored = encryptionService.decrypt(passwordHash);
        if (password == null) {
            return false;
        }
        return MessageDigest.isEqual(
            stored.getBytes(StandardCharsets.UTF_8),
            password.getBytes(StandardCharsets.UTF_8));
    }
}
