package com.licitador.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Key material and key-pair lifecycle settings, bound from {@code licitador.encryption.*}.
 *
 * <p>Keys are base64 strings of exactly 32 bytes. Their content is checked by
 * the cipher constructors, which fail startup with a message naming the key.
 *
 * @param masterKey ChaCha20-Poly1305 master key
 * @param deterministic keys of the deterministic AES cipher
 * @param keyPair one-time RSA key pair settings
 */
@Validated
@ConfigurationProperties(prefix = "licitador.encryption")
public record EncryptionProperties(
    String masterKey,
    @Valid @DefaultValue Deterministic deterministic,
    @Valid @DefaultValue KeyPairSettings keyPair
) {

    public record Deterministic(
        String masterKey,
        String ivGenerationKey
    ) {
        @Override
        public String toString() {
            return "Deterministic[masterKey=****, ivGenerationKey=****]";
        }
    }

    /**
     * @param validity lifetime of an issued key pair
     * @param rsaKeySize modulus size in bits
     */
    public record KeyPairSettings(
        @NotNull @DefaultValue("30m") Duration validity,
        @Min(2048) @DefaultValue("2048") int rsaKeySize
    ) {}

    @Override
    public String toString() {
        return "EncryptionProperties[masterKey=****, deterministic=" + deterministic
            + ", keyPair=" + keyPair + "]";
    }
}
