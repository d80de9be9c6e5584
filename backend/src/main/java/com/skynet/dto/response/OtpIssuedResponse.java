package com.skynet.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response DTO returned whenever an OTP has been issued (signup, forget-password, resend-otp).
 *
 * Example JSON response:
 * <pre>
 * {
 *   "message": "OTP sent to your email for password reset",
 *   "email": "alice@example.com"
 * }
 * </pre>
 *
 * The OTP itself is only ever delivered by email.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OtpIssuedResponse {

    private String message;

    /**
     * Normalized address the OTP was sent to.
     */
    private String email;
}
