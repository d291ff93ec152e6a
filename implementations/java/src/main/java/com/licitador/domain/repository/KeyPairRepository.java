package com.licitador.domain.repository;

import com.licitador.domain.model.KeyPair;

import java.util.Optional;
import java.util.UUID;

/**
 * Persistence port for one-time RSA key pairs.
 *
 * <p>Implementations must:
 * <ul>
 *   <li>Hide inactive and expired pairs from {@link #findActiveById(UUID)}</li>
 *   <li>Treat an update that touches no row as a failure in {@link #deactivate(UUID)}</li>
 *   <li>Make {@link #claim(UUID)} a single conditional update so that at most
 *       one caller ever wins a given pair</li>
 * </ul>
 *
 * @since 1.0.0
 */
public interface KeyPairRepository {

    /**
     * Persist a newly issued key pair.
     *
     * @param keyPair Key pair to insert
     * @throws KeyPairStoreException on I/O failure or duplicate id
     */
    void add(KeyPair keyPair);

    /**
     * Find a key pair that is active and not yet expired.
     *
     * <p>Callers cannot tell "never existed" from "expired" or "deactivated".
     *
     * @param id Key pair ID
     * @return Key pair if usable, empty otherwise
     * @throws KeyPairStoreException on I/O failure
     */
    Optional<KeyPair> findActiveById(UUID id);

    /**
     * Unconditionally deactivate a key pair and stamp its used time.
     *
     * @param id Key pair ID
     * @throws KeyPairStoreException if no row matched or on I/O failure
     */
    void deactivate(UUID id);

    /**
     * Atomically consume a key pair: deactivate it only if it is still active,
     * unused and unexpired.
     *
     * @param id Key pair ID
     * @return true if this call consumed the pair, false if it was already gone
     * @throws KeyPairStoreException on I/O failure
     */
    boolean claim(UUID id);
}
