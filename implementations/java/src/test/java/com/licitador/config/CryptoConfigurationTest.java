package com.licitador.config;

import com.licitador.infrastructure.crypto.CryptoService;
import com.licitador.infrastructure.crypto.DeterministicCryptoService;
import com.licitador.infrastructure.crypto.InvalidKeyConfigurationException;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.validation.BindValidationException;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class CryptoConfigurationTest {

    private static final String KEY_A = "AAECAwQFBgcICQoLDA0ODxAREhMUFRYXGBkaGxwdHh8=";
    private static final String KEY_B = "ICEiIyQlJicoKSorLC0uLzAxMjM0NTY3ODk6Ozw9Pj8=";
    private static final String KEY_C = "QEFCQ0RFRkdISUpLTE1OT1BRUlNUVVZXWFlaW1xdXl8=";

    @Configuration
    @EnableConfigurationProperties(EncryptionProperties.class)
    static class PropertiesConfiguration {
    }

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
        .withUserConfiguration(PropertiesConfiguration.class, CryptoConfiguration.class);

    @Test
    void validKeysProduceBothCiphersAndDefaults() {
        contextRunner
            .withPropertyValues(
                "licitador.encryption.master-key=" + KEY_A,
                "licitador.encryption.deterministic.master-key=" + KEY_B,
                "licitador.encryption.deterministic.iv-generation-key=" + KEY_C)
            .run(context -> {
                assertThat(context).hasSingleBean(CryptoService.class);
                assertThat(context).hasSingleBean(DeterministicCryptoService.class);

                EncryptionProperties properties = context.getBean(EncryptionProperties.class);
                assertThat(properties.keyPair().validity()).isEqualTo(Duration.ofMinutes(30));
                assertThat(properties.keyPair().rsaKeySize()).isEqualTo(2048);
                assertThat(properties.toString()).doesNotContain(KEY_A);

                DeterministicCryptoService deterministic = context.getBean(DeterministicCryptoService.class);
                assertThat(deterministic.decrypt(deterministic.encrypt("B12345678"))).isEqualTo("B12345678");
            });
    }

    @Test
    void missingMasterKeyAbortsStartup() {
        contextRunner
            .withPropertyValues(
                "licitador.encryption.deterministic.master-key=" + KEY_B,
                "licitador.encryption.deterministic.iv-generation-key=" + KEY_C)
            .run(context -> {
                assertThat(context).hasFailed();
                assertThat(context.getStartupFailure())
                    .hasRootCauseInstanceOf(InvalidKeyConfigurationException.class)
                    .rootCause().hasMessageContaining("Master key");
            });
    }

    @Test
    void shortIvKeyAbortsStartup() {
        contextRunner
            .withPropertyValues(
                "licitador.encryption.master-key=" + KEY_A,
                "licitador.encryption.deterministic.master-key=" + KEY_B,
                "licitador.encryption.deterministic.iv-generation-key=AAECAwQFBgcICQoLDA0ODw==")
            .run(context -> {
                assertThat(context).hasFailed();
                assertThat(context.getStartupFailure())
                    .rootCause().hasMessageContaining("IV generation key must be 32 bytes");
            });
    }

    @Test
    void weakRsaKeySizeIsRejected() {
        contextRunner
            .withPropertyValues(
                "licitador.encryption.master-key=" + KEY_A,
                "licitador.encryption.deterministic.master-key=" + KEY_B,
                "licitador.encryption.deterministic.iv-generation-key=" + KEY_C,
                "licitador.encryption.key-pair.rsa-key-size=1024")
            .run(context -> {
                assertThat(context).hasFailed();
                assertThat(context.getStartupFailure()).hasRootCauseInstanceOf(BindValidationException.class);
            });
    }
}
