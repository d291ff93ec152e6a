package com.licitador.interfaces.api.dto;

import com.licitador.application.EncryptedPayload;
import com.licitador.application.FieldMapping;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Login credentials. The password travels RSA-OAEP encrypted under a one-time
 * key pair; the email is sent in clear.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LoginRequest implements EncryptedPayload<LoginRequest> {

    public static final FieldMapping<LoginRequest> MAPPING = FieldMapping.builder(LoginRequest::new)
        .plain("email", LoginRequest::getEmail, LoginRequest::setEmail)
        .encrypted("password", LoginRequest::getPassword, LoginRequest::setPassword)
        .build();

    @NotBlank(message = "Email is required")
    @Email(message = "Email must be valid")
    @Size(max = 255, message = "Email must not exceed 255 characters")
    private String email;

    @NotBlank(message = "Password is required")
    private String password;

    @Override
    public FieldMapping<LoginRequest> fieldMapping() {
        return MAPPING;
    }

    @Override
    public String toString() {
        return "LoginRequest(email=" + email + ", password=****)";
    }
}
