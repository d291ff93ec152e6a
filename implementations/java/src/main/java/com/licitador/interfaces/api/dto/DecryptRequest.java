package com.licitador.interfaces.api.dto;

import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DecryptRequest {

    @NotEmpty(message = "Ciphertext is required")
    private String ciphertext;
}
