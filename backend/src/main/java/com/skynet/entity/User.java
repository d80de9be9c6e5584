package com.skynet.entity;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * User account with credential, verification and one-time passcode state.
 *
 * Accounts start unverified and inactive with an OTP attached. A correct OTP
 * verifies and activates the account; password resets reuse the same OTP columns.
 *
 * Invariants:
 * - otpCode and otpExpiry are both set or both null (use {@link #issueOtp} / {@link #clearOtp})
 * - isActive implies isVerified
 * - email and username are unique
 *
 * otpExpiry holds a UTC wall-clock time.
 *
 * Database Table: users
 */
@Entity
@Table(name = "users", uniqueConstraints = {
    @UniqueConstraint(name = User.EMAIL_CONSTRAINT, columnNames = "email"),
    @UniqueConstraint(name = User.USERNAME_CONSTRAINT, columnNames = "username")
})
@Data
@NoArgsConstructor
@ToString(exclude = {"hashedPassword", "otpCode"})
public class User {

    public static final String EMAIL_CONSTRAINT = "uk_users_email";
    public static final String USERNAME_CONSTRAINT = "uk_users_username";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "username", nullable = false, length = 50)
    private String username;

    /**
     * Stored trimmed and lower-cased.
     */
    @Column(name = "email", nullable = false, length = 255)
    private String email;

    @Column(name = "full_name", length = 255)
    private String fullName;

    /**
     * BCrypt digest; embeds salt and cost factor.
     */
    @Column(name = "hashed_password", nullable = false, length = 100)
    private String hashedPassword;

    @Column(name = "is_verified", nullable = false)
    private Boolean isVerified = false;

    @Column(name = "is_active", nullable = false)
    private Boolean isActive = false;

    @Column(name = "otp_code", length = 6)
    private String otpCode;

    @Column(name = "otp_expiry")
    private LocalDateTime otpExpiry;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    /**
     * Creates a pending account: unverified, inactive, no OTP yet.
     *
     * @param username       unique handle
     * @param email          normalized email address
     * @param fullName       display name
     * @param hashedPassword BCrypt digest of the chosen password
     */
    public User(String username, String email, String fullName, String hashedPassword) {
        this.username = username;
        this.email = email;
        this.fullName = fullName;
        this.hashedPassword = hashedPassword;
        this.isVerified = false;
        this.isActive = false;
    }

    /**
     * Attaches a fresh passcode, replacing any previous one.
     */
    public void issueOtp(String code, LocalDateTime expiry) {
        this.otpCode = code;
        this.otpExpiry = expiry;
    }

    public void clearOtp() {
        this.otpCode = null;
        this.otpExpiry = null;
    }

    public boolean hasPendingOtp() {
        return otpCode != null && otpExpiry != null;
    }

    /**
     * Marks the account verified and active after a successful OTP check.
     */
    public void activate() {
        this.isVerified = true;
        this.isActive = true;
        clearOtp();
    }

    public boolean isVerified() {
        return Boolean.TRUE.equals(isVerified);
    }

    public boolean isActive() {
        return Boolean.TRUE.equals(isActive);
    }
}
