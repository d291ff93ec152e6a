package com.licitador.application;

import com.licitador.application.exceptions.DecryptionException;
import com.licitador.application.exceptions.KeyAlreadyUsedException;
import com.licitador.application.exceptions.KeyGenerationException;
import com.licitador.application.exceptions.KeyNotFoundException;
import com.licitador.config.EncryptionProperties;
import com.licitador.config.PerformanceConfiguration.KeyPairMetrics;
import com.licitador.domain.model.KeyPair;
import com.licitador.domain.repository.KeyPairRepository;
import com.licitador.domain.repository.KeyPairStoreException;
import com.licitador.infrastructure.crypto.RsaKeys;
import com.licitador.interfaces.api.dto.PublicKeyResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.time.Clock;
import java.util.Base64;
import java.util.Objects;
import java.util.UUID;

/**
 * Issues one-time RSA key pairs and decrypts requests sealed with them.
 *
 * <p>Lifecycle of a pair: issued active with a fixed validity, then consumed by
 * exactly one {@code decryptRequest} call or left to expire. Consumption is an
 * atomic conditional update performed before any field is decrypted, so two
 * concurrent requests on the same pair cannot both succeed. A request whose
 * fields fail to decrypt still burns the pair.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AsymmetricFieldDecryptionService {

    private final KeyPairRepository keyPairRepository;
    private final EncryptionProperties properties;
    private final Clock clock;
    private final KeyPairMetrics metrics;

    /**
     * Generate, persist and publish a new key pair.
     *
     * @return key pair id and public key; the private key stays in the store
     * @throws KeyGenerationException if RSA generation or persistence fails
     */
    public PublicKeyResponse generateNewKeyPair() {
        EncryptionProperties.KeyPairSettings settings = properties.keyPair();

        RsaKeys.EncodedKeyPair keys;
        try {
            keys = RsaKeys.generate(settings.rsaKeySize());
        } catch (GeneralSecurityException e) {
            log.error("RSA key generation failed", e);
            throw new KeyGenerationException("Failed to generate RSA key pair", e);
        }

        KeyPair keyPair = KeyPair.issue(
            UUID.randomUUID(),
            keys.publicKey(),
            keys.privateKey(),
            clock.instant(),
            settings.validity()
        );

        try {
            keyPairRepository.add(keyPair);
        } catch (KeyPairStoreException e) {
            throw new KeyGenerationException(e.getMessage(), e);
        }

        metrics.recordKeyPairIssued();
        log.info("Key pair issued: id={}, expiresAt={}", keyPair.getId(), keyPair.getExpiresAt());

        return PublicKeyResponse.builder()
            .keyPairId(keyPair.getId())
            .publicKey(keyPair.getPublicKey())
            .build();
    }

    /**
     * Decrypt a request whose type supplies its own field mapping.
     *
     * @see #decryptRequest(UUID, Object, FieldMapping)
     */
    public <T extends EncryptedPayload<T>> T decryptRequest(UUID keyPairId, T encryptedRequest) {
        Objects.requireNonNull(encryptedRequest, "Encrypted request must not be null");
        return decryptRequest(keyPairId, encryptedRequest, encryptedRequest.fieldMapping());
    }

    /**
     * Consume the key pair and return a copy of {@code encryptedRequest} with
     * its encrypted fields decrypted.
     *
     * @param keyPairId Key pair the client encrypted with
     * @param encryptedRequest Request as received
     * @param mapping Which fields to decrypt and which to copy
     * @return New instance holding plaintext values
     * @throws KeyNotFoundException if the pair is unknown, expired or inactive
     * @throws KeyAlreadyUsedException if the pair was already consumed
     * @throws DecryptionException if the private key or any field cannot be decrypted
     */
    public <T> T decryptRequest(UUID keyPairId, T encryptedRequest, FieldMapping<T> mapping) {
        Objects.requireNonNull(keyPairId, "Key pair id must not be null");
        Objects.requireNonNull(encryptedRequest, "Encrypted request must not be null");
        Objects.requireNonNull(mapping, "Field mapping must not be null");

        KeyPair keyPair = loadActiveKeyPair(keyPairId);

        // Lookup already filters inactive pairs; usedAt is checked as well in case the row is stale
        if (keyPair.isUsed()) {
            metrics.recordRejected("already_used");
            throw new KeyAlreadyUsedException("The key has already been used");
        }

        consume(keyPairId);
        metrics.recordKeyPairConsumed();

        PrivateKey privateKey = importPrivateKey(keyPair);

        T decrypted = mapping.apply(encryptedRequest,
            (fieldName, ciphertext) -> decryptField(privateKey, fieldName, ciphertext));

        log.info("Request decrypted: keyPairId={}, encryptedFields={}",
            keyPairId, mapping.encryptedFieldNames().size());

        return decrypted;
    }

    private KeyPair loadActiveKeyPair(UUID keyPairId) {
        try {
            return keyPairRepository.findActiveById(keyPairId)
                .orElseThrow(() -> {
                    metrics.recordRejected("not_found");
                    return new KeyNotFoundException(
                        "The encryption key does not exist or is no longer active.");
                });
        } catch (KeyPairStoreException e) {
            throw new KeyNotFoundException(e.getMessage(), e);
        }
    }

    private void consume(UUID keyPairId) {
        boolean claimed;
        try {
            claimed = keyPairRepository.claim(keyPairId);
        } catch (KeyPairStoreException e) {
            throw new DecryptionException("Failed to consume key pair", e);
        }

        if (!claimed) {
            metrics.recordRejected("already_used");
            throw new KeyAlreadyUsedException("The key has already been used");
        }
    }

    private static PrivateKey importPrivateKey(KeyPair keyPair) {
        try {
            return RsaKeys.importPrivateKey(keyPair.getPrivateKey());
        } catch (GeneralSecurityException e) {
            log.error("Stored private key is unreadable: keyPairId={}", keyPair.getId(), e);
            throw new DecryptionException("Failed to import private key", e);
        }
    }

    private static String decryptField(PrivateKey privateKey, String fieldName, String ciphertext) {
        try {
            byte[] encrypted = Base64.getDecoder().decode(ciphertext);
            return new String(RsaKeys.decrypt(privateKey, encrypted), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException | GeneralSecurityException e) {
            log.warn("Field decryption failed: field={}", fieldName);
            throw new DecryptionException("Failed to decrypt value", fieldName, e);
        }
    }
}
