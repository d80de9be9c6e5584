package com.skynet.controller;

import com.skynet.dto.request.EmailRequest;
import com.skynet.dto.request.LoginRequest;
import com.skynet.dto.request.ResetPasswordRequest;
import com.skynet.dto.request.SignupRequest;
import com.skynet.dto.request.VerifyOtpRequest;
import com.skynet.dto.response.AccountMessageResponse;
import com.skynet.dto.response.MessageResponse;
import com.skynet.dto.response.OtpIssuedResponse;
import com.skynet.dto.response.TokenResponse;
import com.skynet.dto.response.UserSummary;
import com.skynet.entity.User;
import com.skynet.security.JwtTokenProvider;
import com.skynet.service.AccountService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for the account lifecycle.
 *
 * Public endpoints: signup, verify-otp, login, forget-password, reset-password, resend-otp.
 * Protected endpoint: logout (requires a valid bearer token).
 *
 * Service failures come back as {@link com.skynet.service.AccountResult} values and are
 * unwrapped with {@code orElseThrow()}; GlobalExceptionHandler renders the resulting
 * AccountException with the status declared by its error kind.
 *
 * @see com.skynet.service.AccountService
 */
@RestController
@RequestMapping("/auth")
@RequiredArgsConstructor
@Slf4j
public class AuthController {

    static final String SIGNUP_MESSAGE = "User registered successfully. Please check your email for OTP verification.";
    static final String VERIFIED_MESSAGE = "Account verified successfully! Welcome email sent.";
    static final String RESET_OTP_MESSAGE = "OTP sent to your email for password reset";
    static final String RESET_MESSAGE = "Password reset successfully. You can now login with your new password.";
    static final String RESEND_MESSAGE = "New OTP sent to your email";
    static final String LOGOUT_MESSAGE = "Logged out successfully. Please delete the token from client side.";

    private final AccountService accountService;
    private final JwtTokenProvider jwtTokenProvider;
    private final CurrentAccountResolver currentAccountResolver;

    /**
     * Register a new account and email it an OTP.
     *
     * Endpoint: POST /auth/signup
     *
     * Responses:
     * - 201 Created: account pending verification
     * - 400 Bad Request: email or username taken, or validation failure
     */
    @PostMapping("/signup")
    public ResponseEntity<OtpIssuedResponse> signup(@Valid @RequestBody SignupRequest request) {
        log.info("Signup request received for username: {}", request.getUsername());

        User user = accountService.signup(
                request.getUsername(),
                request.getEmail(),
                request.getFullName(),
                request.getPassword()
        ).orElseThrow();

        OtpIssuedResponse response = OtpIssuedResponse.builder()
                .message(SIGNUP_MESSAGE)
                .email(user.getEmail())
                .build();

        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    /**
     * Verify the signup OTP and activate the account.
     *
     * Endpoint: POST /auth/verify-otp
     *
     * Responses:
     * - 200 OK: account verified and active
     * - 400 Bad Request: already verified, no OTP pending, expired or wrong code
     * - 404 Not Found: unknown email
     */
    @PostMapping("/verify-otp")
    public ResponseEntity<AccountMessageResponse> verifyOtp(@Valid @RequestBody VerifyOtpRequest request) {
        log.info("OTP verification request received for email: {}", request.getEmail());

        User user = accountService.verifyOtp(request.getEmail(), request.getOtp()).orElseThrow();

        return ResponseEntity.ok(AccountMessageResponse.builder()
                .message(VERIFIED_MESSAGE)
                .user(UserSummary.from(user))
                .build());
    }

    /**
     * Authenticate with email and password.
     *
     * Endpoint: POST /auth/login
     *
     * Responses:
     * - 200 OK: bearer token issued
     * - 401 Unauthorized: unknown email or wrong password
     * - 403 Forbidden: account not verified or deactivated
     */
    @PostMapping("/login")
    public ResponseEntity<TokenResponse> login(@Valid @RequestBody LoginRequest request) {
        log.info("Login request received for email: {}", request.getEmail());

        String token = accountService.login(request.getEmail(), request.getPassword()).orElseThrow();

        return ResponseEntity.ok(TokenResponse.builder()
                .accessToken(token)
                .expiresIn(jwtTokenProvider.getTokenTtl().getSeconds())
                .build());
    }

    @PostMapping("/forget-password")
    public ResponseEntity<OtpIssuedResponse> forgetPassword(@Valid @RequestBody EmailRequest request) {
        log.info("Password reset OTP requested for email: {}", request.getEmail());

        User user = accountService.forgotPassword(request.getEmail()).orElseThrow();

        return ResponseEntity.ok(OtpIssuedResponse.builder()
                .message(RESET_OTP_MESSAGE)
                .email(user.getEmail())
                .build());
    }

    /**
     * Set a new password using the OTP from forget-password.
     *
     * Endpoint: POST /auth/reset-password
     */
    @PostMapping("/reset-password")
    public ResponseEntity<MessageResponse> resetPassword(@Valid @RequestBody ResetPasswordRequest request) {
        log.info("Password reset request received for email: {}", request.getEmail());

        accountService.resetPassword(request.getEmail(), request.getOtp(), request.getNewPassword())
                .orElseThrow();

        return ResponseEntity.ok(new MessageResponse(RESET_MESSAGE));
    }

    @PostMapping("/resend-otp")
    public ResponseEntity<OtpIssuedResponse> resendOtp(@Valid @RequestBody EmailRequest request) {
        log.info("OTP resend requested for email: {}", request.getEmail());

        User user = accountService.resendOtp(request.getEmail()).orElseThrow();

        return ResponseEntity.ok(OtpIssuedResponse.builder()
                .message(RESEND_MESSAGE)
                .email(user.getEmail())
                .build());
    }

    /**
     * Logout. Tokens are stateless, so the client discards its token; the server only
     * confirms the identity the token belonged to.
     *
     * Endpoint: POST /auth/logout
     * Authentication: Required (JWT token)
     */
    @PostMapping("/logout")
    public ResponseEntity<AccountMessageResponse> logout(Authentication authentication) {
        User user = currentAccountResolver.require(authentication);
        log.info("Logout for account {}", user.getId());

        return ResponseEntity.ok(AccountMessageResponse.builder()
                .message(LOGOUT_MESSAGE)
                .user(UserSummary.from(user))
                .build());
    }
}
