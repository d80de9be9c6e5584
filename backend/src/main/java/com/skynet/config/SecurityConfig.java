package com.skynet.config;

import com.skynet.security.JwtAuthenticationEntryPoint;
import com.skynet.security.JwtAuthenticationFilter;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

/**
 * Spring Security configuration for JWT-based authentication.
 *
 * - JWT authentication via {@link JwtAuthenticationFilter}
 * - Public endpoints for the account lifecycle, service info and health
 * - Every other endpoint (logout, profile, documents) requires a valid bearer token
 * - Stateless session management, CSRF disabled
 * - Unauthenticated access answered by {@link JwtAuthenticationEntryPoint} (401 problem detail)
 *
 * Authentication Flow:
 * 1. User registers via /auth/signup and receives an OTP by email
 * 2. User verifies the OTP via /auth/verify-otp
 * 3. User logs in via /auth/login and receives a JWT
 * 4. User sends the JWT in the Authorization header (Bearer {token})
 * 5. JwtAuthenticationFilter verifies the token on each request
 *
 * CORS is configured separately in {@link CorsConfig}.
 */
@Configuration
@EnableWebSecurity
@RequiredArgsConstructor
public class SecurityConfig {

    private static final String[] PUBLIC_AUTH_ENDPOINTS = {
            "/auth/signup",
            "/auth/verify-otp",
            "/auth/login",
            "/auth/forget-password",
            "/auth/reset-password",
            "/auth/resend-otp"
    };

    private final JwtAuthenticationFilter jwtAuthenticationFilter;
    private final JwtAuthenticationEntryPoint jwtAuthenticationEntryPoint;

    @Bean
    public SecurityFilterChain filterChain(HttpSecurity http) throws Exception {
        http
                .csrf(AbstractHttpConfigurer::disable)
                .httpBasic(AbstractHttpConfigurer::disable)
                .formLogin(AbstractHttpConfigurer::disable)

                .authorizeHttpRequests(auth -> auth
                        .requestMatchers(HttpMethod.POST, PUBLIC_AUTH_ENDPOINTS).permitAll()
                        .requestMatchers(HttpMethod.GET, "/", "/health").permitAll()
                        .requestMatchers("/error").permitAll()
                        .anyRequest().authenticated()
                )

                .sessionManagement(session -> session
                        .sessionCreationPolicy(SessionCreationPolicy.STATELESS)
                )

                .exceptionHandling(ex -> ex
                        .authenticationEntryPoint(jwtAuthenticationEntryPoint)
                )

                .addFilterBefore(
                        jwtAuthenticationFilter,
                        UsernamePasswordAuthenticationFilter.class
                );

        return http.build();
    }
}
