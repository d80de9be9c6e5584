package com.skynet.repository;

import com.skynet.entity.User;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

/**
 * Repository interface for User entity operations.
 *
 * Spring Data JPA will automatically implement this interface at runtime.
 */
@Repository
public interface UserRepository extends JpaRepository<User, UUID> {

    /**
     * Find a user by their email address without locking.
     *
     * @param email the normalized email address
     * @return Optional containing the user if found, empty otherwise
     */
    Optional<User> findByEmail(String email);

    /**
     * Find a user by email and hold a row-level write lock until the surrounding
     * transaction ends.
     *
     * Every read-check-write on OTP or credential state goes through this method,
     * so two concurrent verifications of the same account are serialized and only
     * one of them can observe the pending OTP.
     *
     * @param email the normalized email address
     * @return Optional containing the locked user if found, empty otherwise
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select u from User u where u.email = :email")
    Optional<User> findByEmailForUpdate(@Param("email") String email);

    /**
     * Check whether either identity is already taken.
     *
     * @param email the normalized email address
     * @param username the requested username
     * @return true if a user with this email or username exists
     */
    boolean existsByEmailOrUsername(String email, String username);
}
