package com.licitador.config;

import com.licitador.infrastructure.crypto.ChaChaCryptoService;
import com.licitador.infrastructure.crypto.CryptoService;
import com.licitador.infrastructure.crypto.DeterministicAesCryptoService;
import com.licitador.infrastructure.crypto.DeterministicCryptoService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Cipher and clock wiring.
 *
 * <p>Both ciphers validate their keys on construction; a missing or malformed
 * key aborts context startup with an {@code InvalidKeyConfigurationException}.
 */
@Configuration
@Slf4j
public class CryptoConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CryptoService cryptoService(EncryptionProperties properties) {
        CryptoService service = new ChaChaCryptoService(properties.masterKey());
        log.info("Symmetric cipher initialized: ChaCha20-Poly1305");
        return service;
    }

    /**
     * Spring infers {@code close()} as the destroy method, which wipes the keys on shutdown.
     */
    @Bean
    public DeterministicCryptoService deterministicCryptoService(EncryptionProperties properties) {
        EncryptionProperties.Deterministic keys = properties.deterministic();
        DeterministicCryptoService service =
            new DeterministicAesCryptoService(keys.masterKey(), keys.ivGenerationKey());
        log.info("Deterministic cipher initialized: AES-256-CBC + HMAC-SHA256");
        return service;
    }
}
