package com.licitador.infrastructure.crypto;

/**
 * Encryption whose output is a pure function of the plaintext, for columns
 * that must support equality lookups on the ciphertext.
 *
 * <p>Leaks equality of plaintexts. Use only for search keys.
 */
public interface DeterministicCryptoService {

    /**
     * @param plaintext non-empty text
     * @return base64 of {@code iv(16) || hmac(32) || ciphertext}, identical for identical input
     * @throws CipherEncryptException if the plaintext is null or empty
     */
    String encrypt(String plaintext);

    /**
     * @param ciphertext base64 envelope produced by {@link #encrypt(String)}
     * @return the original text
     * @throws AuthenticationFailedException if the tag does not match
     * @throws CipherDecryptException if the envelope is malformed or too short
     */
    String decrypt(String ciphertext);
}
