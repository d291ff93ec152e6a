package com.licitador.infrastructure.crypto;

import lombok.extern.slf4j.Slf4j;

import javax.crypto.Cipher;
import javax.crypto.Mac;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.Arrays;
import java.util.Base64;

/**
 * AES-256-CBC with a synthetic IV and an encrypt-then-MAC tag.
 *
 * <p>The IV is the first 16 bytes of {@code HMAC-SHA256(ivGenerationKey, plaintext)},
 * so equal plaintexts encrypt to equal envelopes. The tag is
 * {@code HMAC-SHA256(encryptionKey, iv || ciphertext)} and is checked in constant
 * time before any decryption.
 *
 * <p>Both keys live in private arrays that {@link #close()} zeroes. Spring calls
 * {@code close()} when the context shuts down.
 */
@Slf4j
public class DeterministicAesCryptoService implements DeterministicCryptoService, AutoCloseable {

    static final int KEY_SIZE = 32;
    static final int BLOCK_SIZE = 16;
    static final int HMAC_SIZE = 32;

    private static final String TRANSFORMATION = "AES/CBC/PKCS5Padding";
    private static final String HMAC_ALGORITHM = "HmacSHA256";

    private final byte[] encryptionKey;
    private final byte[] ivGenerationKey;
    private volatile boolean closed;

    /**
     * @param encryptionKeyBase64 base64 of the 32-byte AES and tag key
     * @param ivGenerationKeyBase64 base64 of the 32-byte key used to derive IVs
     * @throws InvalidKeyConfigurationException naming the offending key
     */
    public DeterministicAesCryptoService(String encryptionKeyBase64, String ivGenerationKeyBase64) {
        this.encryptionKey = KeyMaterial.decode("Encryption key", encryptionKeyBase64, KEY_SIZE);
        this.ivGenerationKey = KeyMaterial.decode("IV generation key", ivGenerationKeyBase64, KEY_SIZE);
    }

    @Override
    public String encrypt(String plaintext) {
        if (plaintext == null || plaintext.isEmpty()) {
            throw new CipherEncryptException("The plaintext cannot be null or empty");
        }
        ensureOpen();

        byte[] plainBytes = plaintext.getBytes(StandardCharsets.UTF_8);
        try {
            byte[] iv = deriveIv(plainBytes);

            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(encryptionKey, "AES"), new IvParameterSpec(iv));
            byte[] ciphertext = cipher.doFinal(plainBytes);

            byte[] tag = computeTag(iv, ciphertext);

            byte[] envelope = ByteBuffer.allocate(BLOCK_SIZE + HMAC_SIZE + ciphertext.length)
                .put(iv)
                .put(tag)
                .put(ciphertext)
                .array();
            return Base64.getEncoder().encodeToString(envelope);

        } catch (GeneralSecurityException e) {
            log.error("Deterministic AES encryption failed", e);
            throw new CipherEncryptException("Failed to perform AES encryption", e);
        }
    }

    @Override
    public String decrypt(String ciphertext) {
        if (ciphertext == null || ciphertext.isEmpty()) {
            throw new CipherDecryptException("The ciphertext cannot be null or empty");
        }
        ensureOpen();

        byte[] envelope;
        try {
            envelope = Base64.getDecoder().decode(ciphertext);
        } catch (IllegalArgumentException e) {
            throw new CipherDecryptException("Failed to decode base64 ciphertext", e);
        }

        int minLength = BLOCK_SIZE + HMAC_SIZE;
        if (envelope.length <= minLength) {
            throw new CipherDecryptException(String.format(
                "Encrypted data too short. Expected more than %d bytes, got %d", minLength, envelope.length));
        }

        byte[] iv = Arrays.copyOfRange(envelope, 0, BLOCK_SIZE);
        byte[] tag = Arrays.copyOfRange(envelope, BLOCK_SIZE, minLength);
        byte[] encrypted = Arrays.copyOfRange(envelope, minLength, envelope.length);

        byte[] expectedTag;
        try {
            expectedTag = computeTag(iv, encrypted);
        } catch (GeneralSecurityException e) {
            throw new CipherDecryptException("Failed to compute authentication tag", e);
        }

        if (!MessageDigest.isEqual(tag, expectedTag)) {
            log.warn("Deterministic envelope failed tag verification");
            throw new AuthenticationFailedException(
                "Authentication tag validation failed. Data may be corrupted or tampered with");
        }

        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(encryptionKey, "AES"), new IvParameterSpec(iv));
            return new String(cipher.doFinal(encrypted), StandardCharsets.UTF_8);

        } catch (GeneralSecurityException e) {
            log.error("Deterministic AES decryption failed after tag verification", e);
            throw new CipherDecryptException("Decryption failed. Data might be corrupted or tampered with", e);
        }
    }

    /**
     * Zero both keys. Safe to call more than once.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        synchronized (this) {
            if (!closed) {
                Arrays.fill(encryptionKey, (byte) 0);
                Arrays.fill(ivGenerationKey, (byte) 0);
                closed = true;
                log.debug("Deterministic cipher keys cleared");
            }
        }
    }

    private byte[] deriveIv(byte[] plainBytes) throws GeneralSecurityException {
        Mac mac = Mac.getInstance(HMAC_ALGORITHM);
        mac.init(new SecretKeySpec(ivGenerationKey, HMAC_ALGORITHM));
        return Arrays.copyOf(mac.doFinal(plainBytes), BLOCK_SIZE);
    }

    private byte[] computeTag(byte[] iv, byte[] ciphertext) throws GeneralSecurityException {
        Mac mac = Mac.getInstance(HMAC_ALGORITHM);
        mac.init(new SecretKeySpec(encryptionKey, HMAC_ALGORITHM));
        mac.update(iv);
        return mac.doFinal(ciphertext);
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Deterministic cipher has been closed");
        }
    }
}
