package com.licitador.application.exceptions;

import com.licitador.infrastructure.crypto.EncryptionException;

/**
 * RSA generation or persistence of a new key pair failed.
 */
public class KeyGenerationException extends EncryptionException {

    private static final long serialVersionUID = 1L;

    public KeyGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
