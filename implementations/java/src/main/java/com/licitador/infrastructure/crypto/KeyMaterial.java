package com.licitador.infrastructure.crypto;

import java.util.Arrays;
import java.util.Base64;

/**
 * Decoding and validation of base64 master keys read from configuration.
 */
final class KeyMaterial {

    private KeyMaterial() {}

    /**
     * Decode a base64 key and check its length.
     *
     * @param keyName human name used in error messages, e.g. "IV generation key"
     * @param base64Key configured value
     * @param expectedBytes required decoded length
     * @return a fresh array owned by the caller
     * @throws InvalidKeyConfigurationException if the value is empty, not base64 or the wrong size
     */
    static byte[] decode(String keyName, String base64Key, int expectedBytes) {
        if (base64Key == null || base64Key.isBlank()) {
            throw new InvalidKeyConfigurationException(keyName + " cannot be null or empty");
        }

        byte[] key;
        try {
            key = Base64.getDecoder().decode(base64Key.trim());
        } catch (IllegalArgumentException e) {
            throw new InvalidKeyConfigurationException(keyName + " must be a valid Base64 string", e);
        }

        if (key.length != expectedBytes) {
            int actual = key.length;
            Arrays.fill(key, (byte) 0);
            throw new InvalidKeyConfigurationException(String.format(
                "%s must be %d bytes (%d bits), got %d bytes",
                keyName, expectedBytes, expectedBytes * 8, actual));
        }

        return key;
    }
}
