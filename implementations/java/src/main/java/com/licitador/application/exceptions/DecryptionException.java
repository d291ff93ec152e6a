package com.licitador.application.exceptions;

import com.licitador.infrastructure.crypto.EncryptionException;

import java.util.Optional;

/**
 * A request could not be decrypted with its key pair.
 *
 * <p>When a single field is at fault its name is carried in {@link #getFieldName()}
 * and appended to the message.
 */
public class DecryptionException extends EncryptionException {

    private static final long serialVersionUID = 1L;

    private final String fieldName;

    public DecryptionException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public DecryptionException(String message, String fieldName, Throwable cause) {
        super(fieldName != null ? message + " (Field: '" + fieldName + "')" : message, cause);
        this.fieldName = fieldName;
    }

    public Optional<String> getFieldName() {
        return Optional.ofNullable(fieldName);
    }
}
