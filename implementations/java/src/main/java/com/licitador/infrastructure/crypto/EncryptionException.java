package com.licitador.infrastructure.crypto;

/**
 * Root of every failure raised by the field-encryption pipeline.
 *
 * <p>Subclasses distinguish cipher-level problems (encrypt, decrypt, tampering,
 * bad key configuration) from key-pair lifecycle problems so that the HTTP layer
 * can map each kind to its own status.
 *
 * @since 1.0.0
 */
public abstract class EncryptionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    protected EncryptionException(String message) {
        super(message);
    }

    protected EncryptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
