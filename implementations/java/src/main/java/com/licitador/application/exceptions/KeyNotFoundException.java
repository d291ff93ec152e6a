package com.licitador.application.exceptions;

import com.licitador.infrastructure.crypto.EncryptionException;

/**
 * The key pair is unknown, expired or deactivated. The three cases are
 * deliberately indistinguishable.
 */
public class KeyNotFoundException extends EncryptionException {

    private static final long serialVersionUID = 1L;

    public KeyNotFoundException(String message) {
        super(message);
    }

    public KeyNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
