package com.licitador.application.exceptions;

import com.licitador.infrastructure.crypto.EncryptionException;

/**
 * The key pair has already served its one decryption.
 */
public class KeyAlreadyUsedException extends EncryptionException {

    private static final long serialVersionUID = 1L;

    public KeyAlreadyUsedException(String message) {
        super(message);
    }
}
