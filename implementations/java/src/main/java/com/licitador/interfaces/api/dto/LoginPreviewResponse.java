package com.licitador.interfaces.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of decrypting a {@link LoginRequest}. The password itself is never returned.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LoginPreviewResponse {

    private String email;
    private boolean passwordProvided;
}
