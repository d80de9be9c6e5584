package com.skynet.exception;

import org.springframework.http.HttpStatus;

/**
 * Expected failure kinds of the account lifecycle.
 *
 * Each kind carries the HTTP status and client-facing message used when the
 * failure reaches the REST layer. INVALID_CREDENTIALS deliberately shares one
 * message for unknown email and wrong password.
 */
public enum AccountError {

    CONFLICT(HttpStatus.BAD_REQUEST, "Email or username already registered"),
    NOT_FOUND(HttpStatus.NOT_FOUND, "User not found"),
    INVALID_CREDENTIALS(HttpStatus.UNAUTHORIZED, "Invalid email or password"),
    NOT_VERIFIED(HttpStatus.FORBIDDEN, "Account not verified. Please verify your email first."),
    DEACTIVATED(HttpStatus.FORBIDDEN, "Account is deactivated"),
    ALREADY_VERIFIED(HttpStatus.BAD_REQUEST, "User already verified"),
    NO_OTP_PENDING(HttpStatus.BAD_REQUEST, "No OTP found for this user"),
    EXPIRED(HttpStatus.BAD_REQUEST, "OTP has expired. Please request a new one."),
    INVALID_CODE(HttpStatus.BAD_REQUEST, "Invalid OTP"),
    UNAUTHENTICATED(HttpStatus.UNAUTHORIZED, "Authentication is required to access this resource.");

    private final HttpStatus status;
    private final String message;

    AccountError(HttpStatus status, String message) {
        this.status = status;
        this.message = message;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getMessage() {
        return message;
    }

    /**
     * Problem type suffix, e.g. {@code invalid-code}.
     */
    public String getTypeSlug() {
        return name().toLowerCase().replace('_', '-');
    }
}
