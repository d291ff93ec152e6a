package com.licitador.interfaces.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Public half of a freshly issued one-time key pair.
 *
 * <p>{@code publicKey} is a base64 X.509 SubjectPublicKeyInfo. Clients encrypt
 * each sensitive field with RSA-OAEP (SHA-256, MGF1-SHA-256) and send the
 * result back together with {@code keyPairId}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PublicKeyResponse {

    private UUID keyPairId;
    private String publicKey;
}
