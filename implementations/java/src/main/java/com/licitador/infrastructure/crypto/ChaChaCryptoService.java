package com.licitador.infrastructure.crypto;

import lombok.extern.slf4j.Slf4j;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;

/**
 * ChaCha20-Poly1305 implementation of {@link CryptoService}.
 *
 * <p>Each call draws a fresh 96-bit nonce from {@link SecureRandom}. The JCA
 * cipher emits {@code ciphertext || tag}; this class reorders it into the
 * {@code nonce || tag || ciphertext} envelope and back.
 *
 * <p>Thread-safe: the only shared state is the immutable master key.
 */
@Slf4j
public class ChaChaCryptoService implements CryptoService {

    static final int KEY_SIZE = 32;
    static final int NONCE_SIZE = 12;
    static final int TAG_SIZE = 16;

    private static final String TRANSFORMATION = "ChaCha20-Poly1305";
    private static final String KEY_ALGORITHM = "ChaCha20";

    private final SecretKeySpec masterKey;
    private final SecureRandom secureRandom = new SecureRandom();

    /**
     * @param masterKeyBase64 base64 of exactly 32 bytes
     * @throws InvalidKeyConfigurationException if the key is missing, not base64 or not 32 bytes
     */
    public ChaChaCryptoService(String masterKeyBase64) {
        byte[] key = KeyMaterial.decode("Master key", masterKeyBase64, KEY_SIZE);
        try {
            this.masterKey = new SecretKeySpec(key, KEY_ALGORITHM);
        } finally {
            Arrays.fill(key, (byte) 0);
        }
    }

    @Override
    public String encrypt(String plaintext) {
        return Base64.getEncoder().encodeToString(encryptToBytes(plaintext));
    }

    @Override
    public String encrypt(byte[] content) {
        return Base64.getEncoder().encodeToString(encryptToBytes(content));
    }

    @Override
    public byte[] encryptToBytes(String plaintext) {
        if (plaintext == null) {
            throw new CipherEncryptException("Failed to convert plaintext to bytes: plaintext is null");
        }
        return encryptToBytes(plaintext.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public byte[] encryptToBytes(byte[] content) {
        if (content == null) {
            throw new CipherEncryptException("Failed to encrypt data: content is null");
        }

        try {
            byte[] nonce = new byte[NONCE_SIZE];
            secureRandom.nextBytes(nonce);

            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, masterKey, new IvParameterSpec(nonce));

            // JCA output is ciphertext || tag
            byte[] sealed = cipher.doFinal(content);
            int ciphertextLength = sealed.length - TAG_SIZE;

            return ByteBuffer.allocate(NONCE_SIZE + sealed.length)
                .put(nonce)
                .put(sealed, ciphertextLength, TAG_SIZE)
                .put(sealed, 0, ciphertextLength)
                .array();

        } catch (GeneralSecurityException e) {
            log.error("ChaCha20-Poly1305 encryption failed", e);
            throw new CipherEncryptException("Failed to encrypt data", e);
        }
    }

    @Override
    public String decrypt(String ciphertext) {
        return new String(decryptToBytes(ciphertext), StandardCharsets.UTF_8);
    }

    @Override
    public String decrypt(byte[] ciphertext) {
        return new String(decryptToBytes(ciphertext), StandardCharsets.UTF_8);
    }

    @Override
    public byte[] decryptToBytes(String ciphertext) {
        if (ciphertext == null) {
            throw new CipherDecryptException("Failed to decode base64 ciphertext: ciphertext is null");
        }

        byte[] envelope;
        try {
            envelope = Base64.getDecoder().decode(ciphertext);
        } catch (IllegalArgumentException e) {
            throw new CipherDecryptException("Failed to decode base64 ciphertext", e);
        }
        return decryptToBytes(envelope);
    }

    @Override
    public byte[] decryptToBytes(byte[] ciphertext) {
        if (ciphertext == null) {
            throw new CipherDecryptException("Ciphertext must not be null");
        }

        int minLength = NONCE_SIZE + TAG_SIZE;
        if (ciphertext.length < minLength) {
            throw new CipherDecryptException(String.format(
                "Ciphertext too short. Expected at least %d bytes, got %d", minLength, ciphertext.length));
        }

        byte[] nonce = Arrays.copyOfRange(ciphertext, 0, NONCE_SIZE);
        int encryptedLength = ciphertext.length - minLength;

        byte[] sealed = ByteBuffer.allocate(encryptedLength + TAG_SIZE)
            .put(ciphertext, minLength, encryptedLength)
            .put(ciphertext, NONCE_SIZE, TAG_SIZE)
            .array();

        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, masterKey, new IvParameterSpec(nonce));
            return cipher.doFinal(sealed);

        } catch (AEADBadTagException e) {
            log.warn("ChaCha20-Poly1305 tag verification failed for {} byte envelope", ciphertext.length);
            throw new CipherDecryptException("Decryption failed. Data might be corrupted or tampered with", e);
        } catch (GeneralSecurityException e) {
            log.error("ChaCha20-Poly1305 decryption failed", e);
            throw new CipherDecryptException("Decryption failed. Data might be corrupted or tampered with", e);
        }
    }
}
