package com.licitador.infrastructure.crypto;

/**
 * Randomized authenticated encryption under a single long-lived master key.
 *
 * <p>Envelope layout: {@code nonce(12) || tag(16) || ciphertext}. String
 * variants exchange the envelope as standard base64 and the plaintext as UTF-8.
 * Two encryptions of the same plaintext produce different envelopes.
 *
 * @since 1.0.0
 */
public interface CryptoService {

    /**
     * Encrypt a UTF-8 string.
     *
     * @param plaintext text to protect, may be empty
     * @return base64 envelope
     * @throws CipherEncryptException if the plaintext is null or the cipher fails
     */
    String encrypt(String plaintext);

    /**
     * Encrypt raw bytes.
     *
     * @param content bytes to protect
     * @return base64 envelope
     */
    String encrypt(byte[] content);

    byte[] encryptToBytes(String plaintext);

    byte[] encryptToBytes(byte[] content);

    /**
     * Decrypt a base64 envelope to a UTF-8 string.
     *
     * @param ciphertext base64 envelope
     * @return the original text
     * @throws CipherDecryptException if the envelope is malformed, too short or fails authentication
     */
    String decrypt(String ciphertext);

    String decrypt(byte[] ciphertext);

    byte[] decryptToBytes(String ciphertext);

    byte[] decryptToBytes(byte[] ciphertext);
}
