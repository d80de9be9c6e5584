package com.skynet.dto.request;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Request DTO for password login.
 *
 * Example JSON request:
 * <pre>
 * {
 *   "email": "alice@example.com",
 *   "password": "password123"
 * }
 * </pre>
 *
 * @see com.skynet.dto.response.TokenResponse
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@ToString(exclude = "password")
public class LoginRequest {

    @NotBlank(message = "Email is required")
    @Email(message = "Email must be valid")
    private String email;

    @NotBlank(message = "Password is required")
    private String password;
}
