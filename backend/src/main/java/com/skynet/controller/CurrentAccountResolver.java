package com.skynet.controller;

import com.skynet.entity.User;
import com.skynet.exception.AccountError;
import com.skynet.exception.AccountException;
import com.skynet.service.AccountService;
import lombok.RequiredArgsConstructor;
import org.springframework.security.core.Authentication;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Resolves the authenticated principal of a request to an active account.
 *
 * The principal name is the account id placed there by
 * {@link com.skynet.security.JwtAuthenticationFilter}.
 */
@Component
@RequiredArgsConstructor
public class CurrentAccountResolver {

    private final AccountService accountService;

    public User require(Authentication authentication) {
        if (authentication == null || !authentication.isAuthenticated()) {
            throw new AccountException(AccountError.UNAUTHENTICATED);
        }

        UUID userId;
        try {
            userId = UUID.fromString(authentication.getName());
        } catch (IllegalArgumentException ex) {
            throw new AccountException(AccountError.UNAUTHENTICATED);
        }
        return accountService.requireActiveAccount(userId).orElseThrow();
    }
}
