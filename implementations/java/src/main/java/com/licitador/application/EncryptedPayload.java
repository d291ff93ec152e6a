package com.licitador.application;

/**
 * Request type that carries its own {@link FieldMapping}, so it can be passed
 * to {@link AsymmetricFieldDecryptionService#decryptRequest(java.util.UUID, EncryptedPayload)}
 * without naming the mapping at the call site.
 *
 * @param <T> the implementing type
 */
public interface EncryptedPayload<T extends EncryptedPayload<T>> {

    FieldMapping<T> fieldMapping();
}
