package com.licitador.application;

import com.licitador.infrastructure.crypto.CipherDecryptException;
import com.licitador.infrastructure.crypto.CipherEncryptException;
import com.licitador.infrastructure.crypto.CryptoService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Application-facing symmetric encryption. Rejects null and empty input before
 * it reaches the cipher.
 */
@Service
@RequiredArgsConstructor
public class EncryptionService {

    private final CryptoService cryptoService;

    /**
     * @return base64 ChaCha20-Poly1305 envelope
     * @throws CipherEncryptException if {@code plaintext} is null or empty
     */
    public String encrypt(String plaintext) {
        if (plaintext == null || plaintext.isEmpty()) {
            throw new CipherEncryptException("Plaintext cannot be null or empty");
        }
        return cryptoService.encrypt(plaintext);
    }

    /**
     * @throws CipherDecryptException if {@code ciphertext} is null, empty or not a valid envelope
     */
    public String decrypt(String ciphertext) {
        if (ciphertext == null || ciphertext.isEmpty()) {
            throw new CipherDecryptException("Ciphertext cannot be null or empty");
        }
        return cryptoService.decrypt(ciphertext);
    }
}
