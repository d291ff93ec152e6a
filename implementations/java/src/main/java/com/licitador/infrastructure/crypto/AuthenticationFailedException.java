package com.licitador.infrastructure.crypto;

/**
 * The HMAC tag of a deterministic envelope did not match its contents.
 *
 * <p>Kept apart from {@link CipherDecryptException} so callers can tell a
 * tampered value from a merely malformed one.
 */
public class AuthenticationFailedException extends EncryptionException {

    private static final long serialVersionUID = 1L;

    public AuthenticationFailedException(String message) {
        super(message);
    }
}
