package com.skynet.service;

import com.skynet.entity.User;
import com.skynet.exception.AccountError;
import com.skynet.repository.UserRepository;
import com.skynet.security.JwtTokenProvider;
import com.skynet.security.PasswordHasher;
import com.skynet.service.event.AccountVerifiedEvent;
import com.skynet.service.event.OtpIssuedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Service for the account lifecycle: registration, OTP verification, login and
 * password reset.
 *
 * Account States:
 * - Pending: unverified and inactive, created by signup with an OTP attached
 * - Verified+Active: reached by submitting the correct, unexpired OTP
 * - Deactivated: verified but inactive; enforced at login and on protected requests
 *
 * The OTP columns form a sub-state shared by signup verification and password reset:
 * forgotPassword/resendOtp overwrite them, verifyOtp/resetPassword consume them.
 *
 * Every operation returns an {@link AccountResult}; routine failures such as a wrong
 * code or a duplicate email are values, not exceptions. State-changing operations
 * load the account with a row-level write lock so the read-check-write sequence on
 * the OTP columns is atomic per account.
 *
 * Notifications are published as events and delivered by {@link NotificationListener}
 * after the transaction commits.
 *
 * @see com.skynet.service.OtpService
 * @see com.skynet.security.JwtTokenProvider
 * @see com.skynet.entity.User
 */
@Service
@Slf4j
@RequiredArgsConstructor
@Transactional
public class AccountService {

    private final UserRepository userRepository;
    private final OtpService otpService;
    private final PasswordHasher passwordHasher;
    private final JwtTokenProvider jwtTokenProvider;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    /**
     * Register a new pending account.
     *
     * This method performs the following steps:
     * 1. Normalize the email (trim and lowercase)
     * 2. Reject if the email or username is already registered
     * 3. Hash the password and attach a fresh OTP
     * 4. Persist the account and publish an {@link OtpIssuedEvent}
     *
     * A concurrent signup racing past the pre-check is stopped by the unique
     * constraints and surfaces as a DataIntegrityViolationException at commit.
     *
     * @return the created account, or CONFLICT
     */
    public AccountResult<User> signup(String username, String email, String fullName, String password) {
        String normalizedEmail = normalizeEmail(email);
        String normalizedUsername = username.trim();

        if (userRepository.existsByEmailOrUsername(normalizedEmail, normalizedUsername)) {
            log.warn("Signup rejected, identity already registered: {} / {}", normalizedEmail, normalizedUsername);
            return AccountResult.failure(AccountError.CONFLICT);
        }

        User user = new User(normalizedUsername, normalizedEmail, fullName, passwordHasher.hash(password));
        String otp = otpService.generate();
        user.issueOtp(otp, otpService.expiryFrom(clock.instant()));

        User saved = userRepository.save(user);
        eventPublisher.publishEvent(new OtpIssuedEvent(saved.getEmail(), saved.getFullName(), otp));

        log.info("Registered pending account {} for {}", saved.getId(), normalizedEmail);
        return AccountResult.success(saved);
    }

    /**
     * Consume the signup OTP and activate the account.
     *
     * Checks are evaluated in a fixed order so the reported error is deterministic:
     * NOT_FOUND, ALREADY_VERIFIED, NO_OTP_PENDING, EXPIRED, INVALID_CODE.
     *
     * @return the activated account, or the first failing check
     */
    public AccountResult<User> verifyOtp(String email, String submittedCode) {
        String normalizedEmail = normalizeEmail(email);
        Optional<User> found = userRepository.findByEmailForUpdate(normalizedEmail);
        if (found.isEmpty()) {
            log.warn("OTP verification for unknown email: {}", normalizedEmail);
            return AccountResult.failure(AccountError.NOT_FOUND);
        }

        User user = found.get();
        if (user.isVerified()) {
            log.warn("OTP verification for already verified account {}", user.getId());
            return AccountResult.failure(AccountError.ALREADY_VERIFIED);
        }

        AccountError otpError = checkOtp(user, submittedCode, clock.instant());
        if (otpError != null) {
            log.warn("OTP verification failed for account {}: {}", user.getId(), otpError);
            return AccountResult.failure(otpError);
        }

        user.activate();
        User saved = userRepository.save(user);
        eventPublisher.publishEvent(new AccountVerifiedEvent(saved.getEmail(), saved.getFullName()));

        log.info("Account {} verified and activated", saved.getId());
        return AccountResult.success(saved);
    }

    /**
     * Authenticate with email and password and issue a bearer token.
     *
     * Unknown email and wrong password produce the same INVALID_CREDENTIALS error.
     * Verification state is only reported once the password has matched.
     *
     * @return compact bearer token, or INVALID_CREDENTIALS / NOT_VERIFIED / DEACTIVATED
     */
    @Transactional(readOnly = true)
    public AccountResult<String> login(String email, String password) {
        String normalizedEmail = normalizeEmail(email);
        Optional<User> found = userRepository.findByEmail(normalizedEmail);

        if (found.isEmpty() || !passwordHasher.verify(password, found.get().getHashedPassword())) {
            log.warn("Failed login attempt for {}", normalizedEmail);
            return AccountResult.failure(AccountError.INVALID_CREDENTIALS);
        }

        User user = found.get();
        if (!user.isVerified()) {
            log.warn("Login attempt on unverified account {}", user.getId());
            return AccountResult.failure(AccountError.NOT_VERIFIED);
        }
        if (!user.isActive()) {
            log.warn("Login attempt on deactivated account {}", user.getId());
            return AccountResult.failure(AccountError.DEACTIVATED);
        }

        String token = jwtTokenProvider.issue(user.getId(), clock.instant());
        log.info("Issued access token for account {}", user.getId());
        return AccountResult.success(token);
    }

    /**
     * Attach a fresh OTP for a password reset. Verification state is left untouched.
     *
     * @return the account the OTP was issued for, or NOT_FOUND
     */
    public AccountResult<User> forgotPassword(String email) {
        String normalizedEmail = normalizeEmail(email);
        Optional<User> found = userRepository.findByEmailForUpdate(normalizedEmail);
        if (found.isEmpty()) {
            log.warn("OTP requested for unknown email: {}", normalizedEmail);
            return AccountResult.failure(AccountError.NOT_FOUND);
        }

        User user = found.get();
        String otp = otpService.generate();
        user.issueOtp(otp, otpService.expiryFrom(clock.instant()));
        User saved = userRepository.save(user);
        eventPublisher.publishEvent(new OtpIssuedEvent(saved.getEmail(), saved.getFullName(), otp));

        log.info("Issued new OTP for account {} (valid for {} minutes)",
                saved.getId(), otpService.getOtpExpirationMinutes());
        return AccountResult.success(saved);
    }

    /**
     * Regenerate and redeliver an OTP. Same effect as {@link #forgotPassword(String)}.
     */
    public AccountResult<User> resendOtp(String email) {
        return forgotPassword(email);
    }

    /**
     * Replace the password after checking the pending OTP.
     *
     * Check order: NOT_FOUND, NO_OTP_PENDING, EXPIRED, INVALID_CODE.
     * Verification and active flags are not changed.
     *
     * @return the updated account, or the first failing check
     */
    public AccountResult<User> resetPassword(String email, String submittedCode, String newPassword) {
        String normalizedEmail = normalizeEmail(email);
        Optional<User> found = userRepository.findByEmailForUpdate(normalizedEmail);
        if (found.isEmpty()) {
            log.warn("Password reset for unknown email: {}", normalizedEmail);
            return AccountResult.failure(AccountError.NOT_FOUND);
        }

        User user = found.get();
        AccountError otpError = checkOtp(user, submittedCode, clock.instant());
        if (otpError != null) {
            log.warn("Password reset failed for account {}: {}", user.getId(), otpError);
            return AccountResult.failure(otpError);
        }

        user.setHashedPassword(passwordHasher.hash(newPassword));
        user.clearOtp();
        User saved = userRepository.save(user);

        log.info("Password reset for account {}", saved.getId());
        return AccountResult.success(saved);
    }

    /**
     * Resolve a token subject to an account that may still use protected routes.
     *
     * Tokens are not revoked, so account state is re-checked on every protected request.
     *
     * @param userId the verified token subject
     * @return the account, or UNAUTHENTICATED / DEACTIVATED / NOT_VERIFIED
     */
    @Transactional(readOnly = true)
    public AccountResult<User> requireActiveAccount(UUID userId) {
        Optional<User> found = userRepository.findById(userId);
        if (found.isEmpty()) {
            log.warn("Token subject {} no longer exists", userId);
            return AccountResult.failure(AccountError.UNAUTHENTICATED);
        }

        User user = found.get();
        if (!user.isVerified()) {
            return AccountResult.failure(AccountError.NOT_VERIFIED);
        }
        if (!user.isActive()) {
            return AccountResult.failure(AccountError.DEACTIVATED);
        }
        return AccountResult.success(user);
    }

    /**
     * OTP checks shared by verification and reset.
     *
     * @return the first failing check, or null if the code may be consumed
     */
    private AccountError checkOtp(User user, String submittedCode, Instant now) {
        if (!user.hasPendingOtp()) {
            return AccountError.NO_OTP_PENDING;
        }
        if (!otpService.isValid(user.getOtpExpiry(), now)) {
            return AccountError.EXPIRED;
        }
        if (!user.getOtpCode().equals(submittedCode)) {
            return AccountError.INVALID_CODE;
        }
        return null;
    }

    static String normalizeEmail(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }
}
