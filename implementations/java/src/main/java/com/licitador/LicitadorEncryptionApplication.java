package com.licitador;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.EnableAspectJAutoProxy;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Field-encryption backend of the Licitador platform.
 *
 * <ul>
 *   <li><strong>Symmetric encryption</strong>: ChaCha20-Poly1305 under a master key</li>
 *   <li><strong>Searchable encryption</strong>: deterministic AES-256-CBC with HMAC-SHA256 tags</li>
 *   <li><strong>Request sealing</strong>: one-time RSA-2048 key pairs, consumed atomically on first use</li>
 * </ul>
 *
 * <p>Keys are read from {@code licitador.encryption.*}; startup fails if any is
 * missing or has the wrong size.
 *
 * @since 1.0.0
 */
@SpringBootApplication
@EnableTransactionManagement
@EnableAspectJAutoProxy
@ConfigurationPropertiesScan
@Slf4j
public class LicitadorEncryptionApplication {

    public static void main(String[] args) {
        SpringApplication.run(LicitadorEncryptionApplication.class, args);

        log.info("Licitador field-encryption service started");
    }
}
