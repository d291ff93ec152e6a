package com.licitador.infrastructure.crypto;

/**
 * Thrown when a plaintext cannot be encrypted: it is missing, cannot be
 * encoded, or the underlying cipher call failed.
 */
public class CipherEncryptException extends EncryptionException {

    private static final long serialVersionUID = 1L;

    public CipherEncryptException(String message) {
        super(message);
    }

    public CipherEncryptException(String message, Throwable cause) {
        super(message, cause);
    }
}
