package com.skynet.service;

import com.skynet.exception.AccountError;
import com.skynet.exception.AccountException;

import java.util.Objects;

/**
 * Result of an account operation: a value on success, an {@link AccountError} otherwise.
 *
 * @param <T> success value type
 */
public final class AccountResult<T> {

    private final T value;
    private final AccountError error;

    private AccountResult(T value, AccountError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> AccountResult<T> success(T value) {
        return new AccountResult<>(Objects.requireNonNull(value, "value"), null);
    }

    public static <T> AccountResult<T> failure(AccountError error) {
        return new AccountResult<>(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public T getValue() {
        if (!isSuccess()) {
            throw new IllegalStateException("No value on failed result: " + error);
        }
        return value;
    }

    public AccountError getError() {
        if (isSuccess()) {
            throw new IllegalStateException("No error on successful result");
        }
        return error;
    }

    /**
     * Unwraps the value, raising the carried error for the HTTP layer.
     *
     * @throws AccountException if this result is a failure
     */
    public T orElseThrow() {
        if (!isSuccess()) {
            throw new AccountException(error);
        }
        return value;
    }

    @Override
    public String toString() {
        return isSuccess() ? "AccountResult[success]" : "AccountResult[" + error + "]";
    }
}
