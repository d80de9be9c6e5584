package com.skynet.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Message plus the account it concerns, returned by verify-otp and logout.
 *
 * Example JSON response:
 * <pre>
 * {
 *   "message": "Account verified successfully! Welcome email sent.",
 *   "user": {
 *     "id": "550e8400-e29b-41d4-a716-446655440000",
 *     "username": "alice",
 *     "email": "alice@example.com",
 *     "fullName": "Alice A"
 *   }
 * }
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AccountMessageResponse {

    private String message;
    private UserSummary user;
}
