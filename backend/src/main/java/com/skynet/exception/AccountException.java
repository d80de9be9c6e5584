package com.skynet.exception;

/**
 * Raised at the REST boundary when an account operation returned a failure result.
 *
 * The service layer reports routine failures as {@link com.skynet.service.AccountResult}
 * values; controllers unwrap them with {@code orElseThrow()} and this exception carries
 * the {@link AccountError} to GlobalExceptionHandler, which maps it to the declared
 * HTTP status in RFC 7807 format.
 *
 * @see com.skynet.exception.GlobalExceptionHandler
 */
public class AccountException extends RuntimeException {

    private final AccountError error;

    public AccountException(AccountError error) {
        super(error.getMessage());
        this.error = error;
    }

    public AccountError getError() {
        return error;
    }
}
