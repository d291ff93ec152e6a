package com.licitador.interfaces.api.dto;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EncryptRequest {

    @NotEmpty(message = "Plaintext is required")
    @Size(max = 65536, message = "Plaintext must not exceed 65536 characters")
    private String plaintext;
}
