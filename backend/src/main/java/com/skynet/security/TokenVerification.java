package com.skynet.security;

import java.util.Objects;
import java.util.UUID;

/**
 * Outcome of verifying a bearer token.
 *
 * Either {@link Status#VALID} with the subject id, or one of the failure statuses
 * with no subject. Callers never get a subject out of a token that failed any check.
 */
public final class TokenVerification {

    public enum Status {
        VALID,
        MALFORMED,
        INVALID_SIGNATURE,
        EXPIRED,
        UNSUPPORTED
    }

    private final Status status;
    private final UUID subjectId;

    private TokenVerification(Status status, UUID subjectId) {
        this.status = status;
        this.subjectId = subjectId;
    }

    public static TokenVerification valid(UUID subjectId) {
        return new TokenVerification(Status.VALID, Objects.requireNonNull(subjectId, "subjectId"));
    }

    public static TokenVerification failure(Status status) {
        if (status == Status.VALID) {
            throw new IllegalArgumentException("A failure cannot carry status VALID");
        }
        return new TokenVerification(status, null);
    }

    public boolean isValid() {
        return status == Status.VALID;
    }

    public Status getStatus() {
        return status;
    }

    /**
     * @return the subject id
     * @throws IllegalStateException if the token did not verify
     */
    public UUID getSubjectId() {
        if (!isValid()) {
            throw new IllegalStateException("Token is not valid: " + status);
        }
        return subjectId;
    }

    @Override
    public String toString() {
        return isValid() ? "TokenVerification[VALID, " + subjectId + "]" : "TokenVerification[" + status + "]";
    }
}
