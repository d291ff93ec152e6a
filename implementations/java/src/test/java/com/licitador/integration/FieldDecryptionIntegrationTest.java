package com.licitador.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.licitador.application.AsymmetricFieldDecryptionService;
import com.licitador.application.exceptions.KeyAlreadyUsedException;
import com.licitador.application.exceptions.KeyNotFoundException;
import com.licitador.infrastructure.crypto.RsaKeys;
import com.licitador.infrastructure.persistence.SpringDataKeyPairRepository;
import com.licitador.interfaces.api.dto.LoginRequest;
import com.licitador.interfaces.api.dto.PublicKeyResponse;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@Testcontainers(disabledWithoutDocker = true)
@SpringBootTest
@AutoConfigureMockMvc
class FieldDecryptionIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("licitador")
            .withUsername("licitador")
            .withPassword("changeme");

    @DynamicPropertySource
    static void registerProps(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @Autowired
    MockMvc mockMvc;

    @Autowired
    ObjectMapper objectMapper;

    @Autowired
    AsymmetricFieldDecryptionService fieldDecryptionService;

    @Autowired
    SpringDataKeyPairRepository springDataRepository;

    @Test
    void sealedLoginDecryptsOnceOverHttp() throws Exception {
        String body = mockMvc.perform(post("/api/v1/encryption/key-pairs"))
            .andExpect(status().isCreated())
            .andReturn().getResponse().getContentAsString();
        JsonNode issued = objectMapper.readTree(body);
        UUID keyPairId = UUID.fromString(issued.get("keyPairId").asText());

        String request = objectMapper.writeValueAsString(Map.of(
            "email", "buyer@licitador.es",
            "password", seal(issued.get("publicKey").asText(), "secret-value")));

        mockMvc.perform(post("/api/v1/encryption/key-pairs/{id}/login-preview", keyPairId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(request))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.email").value("buyer@licitador.es"))
            .andExpect(jsonPath("$.passwordProvided").value(true));

        mockMvc.perform(post("/api/v1/encryption/key-pairs/{id}/login-preview", keyPairId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(request))
            .andExpect(status().isNotFound());

        assertNotNull(springDataRepository.findById(keyPairId).orElseThrow().getUsedAt());
    }

    @Test
    void symmetricEncryptionRoundTripsOverHttp() throws Exception {
        String body = mockMvc.perform(post("/api/v1/encryption/encrypt")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"plaintext\":\"Oferta económica\"}"))
            .andExpect(status().isOk())
            .andReturn().getResponse().getContentAsString();
        String ciphertext = objectMapper.readTree(body).get("ciphertext").asText();

        mockMvc.perform(post("/api/v1/encryption/decrypt")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(Map.of("ciphertext", ciphertext))))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.plaintext").value("Oferta económica"));
    }

    @Test
    void concurrentRequestsConsumeKeyPairExactlyOnce() throws Exception {
        PublicKeyResponse issued = fieldDecryptionService.generateNewKeyPair();
        LoginRequest sealed = LoginRequest.builder()
            .email("race@licitador.es")
            .password(seal(issued.getPublicKey(), "secret-value"))
            .build();

        int callers = 8;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(callers);
        List<Future<LoginRequest>> results = new ArrayList<>();
        try {
            for (int i = 0; i < callers; i++) {
                Callable<LoginRequest> call = () -> {
                    start.await();
                    return fieldDecryptionService.decryptRequest(issued.getKeyPairId(), sealed);
                };
                results.add(executor.submit(call));
            }
            start.countDown();

            int succeeded = 0;
            for (Future<LoginRequest> result : results) {
                try {
                    assertEquals("secret-value", result.get().getPassword());
                    succeeded++;
                } catch (ExecutionException e) {
                    // Losers either saw the pair gone or lost the claim
                    assertTrue(e.getCause() instanceof KeyAlreadyUsedException
                        || e.getCause() instanceof KeyNotFoundException,
                        () -> "Unexpected failure: " + e.getCause());
                }
            }
            assertEquals(1, succeeded);
        } finally {
            executor.shutdownNow();
        }
    }

    private static String seal(String publicKey, String plaintext) throws GeneralSecurityException {
        byte[] ciphertext = RsaKeys.encrypt(RsaKeys.importPublicKey(publicKey),
            plaintext.getBytes(StandardCharsets.UTF_8));
        return Base64.getEncoder().encodeToString(ciphertext);
    }
}
