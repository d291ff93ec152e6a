package com.licitador.infrastructure.persistence;

import com.licitador.domain.model.KeyPair;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Spring Data JPA repository for one-time key pairs.
 *
 * Updates bypass the persistence context and clear it afterwards, so a pair
 * loaded earlier in the same transaction is never written back over a claim.
 */
@Repository
public interface SpringDataKeyPairRepository extends JpaRepository<KeyPair, UUID> {

    /**
     * Find a key pair that is active and expires after {@code now}.
     */
    @Query("SELECT k FROM KeyPair k WHERE k.id = :id AND k.active = true AND k.expiresAt > :now")
    Optional<KeyPair> findActiveById(@Param("id") UUID id, @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE KeyPair k SET k.active = false, k.usedAt = :now WHERE k.id = :id")
    int deactivate(@Param("id") UUID id, @Param("now") Instant now);

    /**
     * Conditional consume. Returns the number of rows changed (0 or 1).
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE KeyPair k SET k.active = false, k.usedAt = :now "
        + "WHERE k.id = :id AND k.active = true AND k.usedAt IS NULL AND k.expiresAt > :now")
    int claim(@Param("id") UUID id, @Param("now") Instant now);
}
