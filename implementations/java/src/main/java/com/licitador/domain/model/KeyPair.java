package com.licitador.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Ephemeral RSA key pair handed out for a single field-decryption request.
 *
 * <p><strong>Invariants:</strong>
 * <ul>
 *   <li>Usable iff {@code active}, {@code now < expiresAt} and {@code usedAt == null}</li>
 *   <li>Consumption sets {@code usedAt} and clears {@code active}; it never reverts</li>
 *   <li>The private key never leaves the service boundary</li>
 * </ul>
 *
 * <p>Consumption happens in the store through a conditional update, so this
 * entity has no mutators.
 *
 * @since 1.0.0
 */
@Entity
@Table(name = "key_pairs")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED) // JPA requirement
public class KeyPair {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    /**
     * Base64 X.509 SubjectPublicKeyInfo.
     */
    @Column(name = "public_key", nullable = false, updatable = false, columnDefinition = "TEXT")
    private String publicKey;

    /**
     * Base64 PKCS#8. Stored in the clear, see DESIGN.md.
     */
    @Column(name = "private_key", nullable = false, updatable = false, columnDefinition = "TEXT")
    private String privateKey;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "expires_at", nullable = false, updatable = false)
    private Instant expiresAt;

    @Column(name = "used_at")
    private Instant usedAt;

    private KeyPair(
            UUID id,
            String publicKey,
            String privateKey,
            boolean active,
            Instant createdAt,
            Instant expiresAt,
            Instant usedAt) {

        this.id = Objects.requireNonNull(id, "Key pair id must not be null");
        this.publicKey = Objects.requireNonNull(publicKey, "Public key must not be null");
        this.privateKey = Objects.requireNonNull(privateKey, "Private key must not be null");
        this.active = active;
        this.createdAt = Objects.requireNonNull(createdAt, "Creation time must not be null");
        this.expiresAt = Objects.requireNonNull(expiresAt, "Expiry must not be null");
        this.usedAt = usedAt;
    }

    /**
     * Create a new, active key pair valid for {@code validity} from {@code issuedAt}.
     *
     * @param id Key pair ID
     * @param publicKey Base64 public key
     * @param privateKey Base64 private key
     * @param issuedAt Creation timestamp
     * @param validity Lifetime of the pair
     * @return New KeyPair instance
     * @throws IllegalArgumentException if validity is not positive
     */
    public static KeyPair issue(
            UUID id,
            String publicKey,
            String privateKey,
            Instant issuedAt,
            Duration validity) {

        if (validity == null || validity.isZero() || validity.isNegative()) {
            throw new IllegalArgumentException("Key pair validity must be positive");
        }

        return new KeyPair(id, publicKey, privateKey, true, issuedAt, issuedAt.plus(validity), null);
    }

    /**
     * Rebuild a key pair in an arbitrary state. Used when loading fixtures.
     */
    public static KeyPair reconstitute(
            UUID id,
            String publicKey,
            String privateKey,
            boolean active,
            Instant createdAt,
            Instant expiresAt,
            Instant usedAt) {

        return new KeyPair(id, publicKey, privateKey, active, createdAt, expiresAt, usedAt);
    }

    public boolean isUsed() {
        return usedAt != null;
    }

    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public boolean isUsableAt(Instant now) {
        return active && !isUsed() && !isExpiredAt(now);
    }

    @Override
    public String toString() {
        return String.format(
            "KeyPair[id=%s, active=%s, createdAt=%s, expiresAt=%s, usedAt=%s]",
            id, active, createdAt, expiresAt, usedAt
        );
    }
}
