package com.skynet.dto.response;

import com.skynet.entity.User;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Profile of the authenticated account, returned by {@code GET /users/me}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserProfileResponse {

    private UUID id;
    private String username;
    private String email;
    private String fullName;
    private Boolean isVerified;
    private Boolean isActive;
    private LocalDateTime createdAt;
    private long documentCount;

    public static UserProfileResponse from(User user, long documentCount) {
        return UserProfileResponse.builder()
                .id(user.getId())
                .username(user.getUsername())
                .email(user.getEmail())
                .fullName(user.getFullName())
                .isVerified(user.isVerified())
                .isActive(user.isActive())
                .createdAt(user.getCreatedAt())
                .documentCount(documentCount)
                .build();
    }
}
