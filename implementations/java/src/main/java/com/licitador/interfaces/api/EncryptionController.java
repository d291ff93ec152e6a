package com.licitador.interfaces.api;

import com.licitador.application.AsymmetricFieldDecryptionService;
import com.licitador.application.EncryptionService;
import com.licitador.interfaces.api.dto.*;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * REST controller for encryption operations.
 *
 * Provides endpoints for:
 * - Issuing one-time RSA key pairs for request sealing
 * - Symmetric encryption and decryption under the master key
 * - Decrypting a sealed login request
 *
 * Plaintexts, ciphertexts and keys are never logged.
 *
 * @since 1.0.0
 */
@RestController
@RequestMapping("/api/v1/encryption")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Encryption", description = "Key pairs and field encryption")
public class EncryptionController {

    private final AsymmetricFieldDecryptionService fieldDecryptionService;
    private final EncryptionService encryptionService;

    /**
     * Issue a new one-time key pair.
     *
     * @return key pair id and base64 public key
     */
    @PostMapping(
        value = "/key-pairs",
        produces = MediaType.APPLICATION_JSON_VALUE
    )
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(
        summary = "Issue one-time key pair",
        description = "Generates an RSA-2048 key pair valid for a single decryption within its validity window"
    )
    @ApiResponses({
        @ApiResponse(
            responseCode = "201",
            description = "Key pair issued",
            content = @Content(schema = @Schema(implementation = PublicKeyResponse.class))
        ),
        @ApiResponse(
            responseCode = "500",
            description = "Key generation or persistence failed",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public ResponseEntity<PublicKeyResponse> issueKeyPair() {

        PublicKeyResponse response = fieldDecryptionService.generateNewKeyPair();

        return ResponseEntity
            .status(HttpStatus.CREATED)
            .body(response);
    }

    /**
     * Encrypt a value under the master key.
     */
    @PostMapping(
        value = "/encrypt",
        consumes = MediaType.APPLICATION_JSON_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE
    )
    @Operation(summary = "Encrypt value", description = "ChaCha20-Poly1305 under the service master key")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Value encrypted"),
        @ApiResponse(
            responseCode = "400",
            description = "Empty plaintext",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public ResponseEntity<EncryptResponse> encrypt(@Valid @RequestBody EncryptRequest request) {

        String ciphertext = encryptionService.encrypt(request.getPlaintext());

        return ResponseEntity.ok(EncryptResponse.builder()
            .ciphertext(ciphertext)
            .build());
    }

    /**
     * Decrypt a value produced by {@link #encrypt(EncryptRequest)}.
     */
    @PostMapping(
        value = "/decrypt",
        consumes = MediaType.APPLICATION_JSON_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE
    )
    @Operation(summary = "Decrypt value", description = "Verifies the Poly1305 tag and returns the plaintext")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Value decrypted"),
        @ApiResponse(
            responseCode = "400",
            description = "Malformed, truncated or tampered ciphertext",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public ResponseEntity<DecryptResponse> decrypt(@Valid @RequestBody DecryptRequest request) {

        String plaintext = encryptionService.decrypt(request.getCiphertext());

        return ResponseEntity.ok(DecryptResponse.builder()
            .plaintext(plaintext)
            .build());
    }

    /**
     * Decrypt a login request sealed with a key pair. Consumes the key pair.
     *
     * @param keyPairId Key pair the password was encrypted with
     * @param request Email in clear, password as base64 RSA-OAEP ciphertext
     * @return Email and whether a password was recovered
     */
    @PostMapping(
        value = "/key-pairs/{keyPairId}/login-preview",
        consumes = MediaType.APPLICATION_JSON_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE
    )
    @Operation(
        summary = "Decrypt sealed login",
        description = "Consumes the key pair and decrypts the password field; the password is not echoed"
    )
    @ApiResponses({
        @ApiResponse(
            responseCode = "200",
            description = "Request decrypted",
            content = @Content(schema = @Schema(implementation = LoginPreviewResponse.class))
        ),
        @ApiResponse(
            responseCode = "404",
            description = "Key pair unknown, expired or inactive",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
            responseCode = "409",
            description = "Key pair already used",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
            responseCode = "422",
            description = "A field could not be decrypted",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public ResponseEntity<LoginPreviewResponse> loginPreview(
            @PathVariable UUID keyPairId,
            @Valid @RequestBody LoginRequest request) {

        if (log.isInfoEnabled()) {
            log.info("Decrypting sealed login: keyPairId={}", keyPairId);
        }

        LoginRequest decrypted = fieldDecryptionService.decryptRequest(keyPairId, request);

        return ResponseEntity.ok(LoginPreviewResponse.builder()
            .email(decrypted.getEmail())
            .passwordProvided(decrypted.getPassword() != null && !decrypted.getPassword().isEmpty())
            .build());
    }
}
