package com.skynet.dto.request;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Request DTO for account registration.
 *
 * Example JSON request:
 * <pre>
 * {
 *   "username": "alice",
 *   "email": "alice@example.com",
 *   "fullName": "Alice A",
 *   "password": "password123"
 * }
 * </pre>
 *
 * The email is normalized (trimmed and lowercased) by the service before it is stored.
 *
 * @see com.skynet.dto.response.OtpIssuedResponse
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@ToString(exclude = "password")
public class SignupRequest {

    @NotBlank(message = "Username is required")
    @Size(min = 3, max = 50, message = "Username must be between 3 and 50 characters")
    private String username;

    @NotBlank(message = "Email is required")
    @Email(message = "Email must be valid")
    private String email;

    @NotBlank(message = "Full name is required")
    @Size(max = 255, message = "Full name must be at most 255 characters")
    private String fullName;

    /**
     * Plain password, hashed with BCrypt before storage. Never logged.
     */
    @NotBlank(message = "Password is required")
    @Size(min = 8, max = 72, message = "Password must be between 8 and 72 characters")
    private String password;
}
