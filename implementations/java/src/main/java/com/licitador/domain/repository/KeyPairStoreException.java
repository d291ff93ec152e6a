package com.licitador.domain.repository;

/**
 * Generic failure of the key-pair store: I/O problems, constraint violations,
 * or an update that matched no row.
 */
public class KeyPairStoreException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public KeyPairStoreException(String message) {
        super(message);
    }

    public KeyPairStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
