package com.skynet.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.lang.NonNull;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.time.Clock;

/**
 * JWT Authentication Filter for request validation.
 *
 * Filter Execution Flow:
 * 1. Extract the bearer token from the Authorization header
 * 2. Verify signature and expiry against the application clock
 * 3. If valid, set an Authentication whose principal is the account id
 * 4. Pass the request to the next filter in the chain
 *
 * Requests without a usable token continue unauthenticated; protected routes are
 * then rejected by {@link JwtAuthenticationEntryPoint}.
 *
 * @see JwtTokenProvider
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private final JwtTokenProvider jwtTokenProvider;
    private final Clock clock;

    @Override
    protected void doFilterInternal(
            @NonNull HttpServletRequest request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain filterChain
    ) throws ServletException, IOException {
        String token = jwtTokenProvider.extractTokenFromHeader(request.getHeader(HttpHeaders.AUTHORIZATION));

        if (token != null) {
            TokenVerification verification = jwtTokenProvider.verify(token, clock.instant());
            if (verification.isValid()) {
                Authentication authentication = jwtTokenProvider.getAuthentication(verification.getSubjectId());
                SecurityContextHolder.getContext().setAuthentication(authentication);

                log.debug("Set authentication for user: {} on path: {}",
                        authentication.getPrincipal(),
                        request.getRequestURI());
            } else {
                log.warn("Rejected bearer token ({}) on path: {}",
                        verification.getStatus(), request.getRequestURI());
                SecurityContextHolder.clearContext();
            }
        }

        filterChain.doFilter(request, response);
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        // Spring Boot's internal error dispatch
        return request.getRequestURI().startsWith("/error");
    }
}
