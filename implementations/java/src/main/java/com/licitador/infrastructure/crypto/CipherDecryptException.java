package com.licitador.infrastructure.crypto;

/**
 * Thrown when an envelope cannot be decrypted: malformed base64, too short,
 * or rejected by the cipher (wrong key, bad tag).
 */
public class CipherDecryptException extends EncryptionException {

    private static final long serialVersionUID = 1L;

    public CipherDecryptException(String message) {
        super(message);
    }

    public CipherDecryptException(String message, Throwable cause) {
        super(message, cause);
    }
}
