package com.licitador.infrastructure.crypto;

/**
 * Key material supplied at startup is missing, not base64, or the wrong size.
 *
 * <p>Raised from cipher constructors only. A process that sees this exception
 * must not start.
 */
public class InvalidKeyConfigurationException extends EncryptionException {

    private static final long serialVersionUID = 1L;

    public InvalidKeyConfigurationException(String message) {
        super(message);
    }

    public InvalidKeyConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
