package com.licitador.infrastructure.persistence;

import com.licitador.domain.model.KeyPair;
import com.licitador.domain.repository.KeyPairRepository;
import com.licitador.domain.repository.KeyPairStoreException;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Adapter implementing the domain KeyPairRepository using Spring Data JPA.
 *
 * Responsibilities:
 * - Apply the active/unexpired filter using the application clock
 * - Insert with persist semantics so a duplicate id fails instead of merging
 * - Translate JPA and Spring data-access failures into KeyPairStoreException
 *
 * Claim SQL (PostgreSQL):
 * UPDATE key_pairs SET is_active = false, used_at = ?
 * WHERE id = ? AND is_active AND used_at IS NULL AND expires_at > ?;
 */
@Component
@Transactional
@RequiredArgsConstructor
@Slf4j
public class KeyPairRepositoryAdapter implements KeyPairRepository {

    private final SpringDataKeyPairRepository springDataRepository;
    private final EntityManager entityManager;
    private final Clock clock;

    @Override
    public void add(KeyPair keyPair) {
        try {
            entityManager.persist(keyPair);
            entityManager.flush();
        } catch (PersistenceException | DataAccessException e) {
            log.error("Failed to insert key pair: id={}", keyPair.getId(), e);
            throw new KeyPairStoreException("Error inserting encryption key.", e);
        }

        log.debug("Key pair persisted: id={}, expiresAt={}", keyPair.getId(), keyPair.getExpiresAt());
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<KeyPair> findActiveById(UUID id) {
        Optional<KeyPair> result;
        try {
            result = springDataRepository.findActiveById(id, now());
        } catch (PersistenceException | DataAccessException e) {
            log.error("Failed to load key pair: id={}", id, e);
            throw new KeyPairStoreException(
                "An unexpected error occurred while obtaining the encryption key.", e);
        }

        if (result.isEmpty()) {
            log.debug("Key pair not found, inactive or expired: id={}", id);
        }

        return result;
    }

    @Override
    public void deactivate(UUID id) {
        int affectedRows;
        try {
            affectedRows = springDataRepository.deactivate(id, now());
        } catch (PersistenceException | DataAccessException e) {
            log.error("Failed to deactivate key pair: id={}", id, e);
            throw new KeyPairStoreException(
                "An unexpected error occurred while disabling the encryption key.", e);
        }

        if (affectedRows == 0) {
            throw new KeyPairStoreException("The encryption key does not exist.");
        }

        log.info("Key pair deactivated: id={}", id);
    }

    @Override
    public boolean claim(UUID id) {
        int affectedRows;
        try {
            affectedRows = springDataRepository.claim(id, now());
        } catch (PersistenceException | DataAccessException e) {
            log.error("Failed to claim key pair: id={}", id, e);
            throw new KeyPairStoreException(
                "An unexpected error occurred while consuming the encryption key.", e);
        }

        if (affectedRows == 0) {
            log.warn("Key pair claim lost: id={}", id);
            return false;
        }

        log.info("Key pair consumed: id={}", id);
        return true;
    }

    private Instant now() {
        return clock.instant();
    }
}
