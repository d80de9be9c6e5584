package com.skynet.controller;

import com.skynet.dto.response.UserProfileResponse;
import com.skynet.entity.User;
import com.skynet.service.DocumentService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/users")
@RequiredArgsConstructor
@Slf4j
public class UserController {

    private final CurrentAccountResolver currentAccountResolver;
    private final DocumentService documentService;

    /**
     * Profile of the caller.
     *
     * Endpoint: GET /users/me
     * Authentication: Required (JWT token)
     */
    @GetMapping("/me")
    public ResponseEntity<UserProfileResponse> me(Authentication authentication) {
        User user = currentAccountResolver.require(authentication);
        log.debug("Profile requested for account {}", user.getId());

        return ResponseEntity.ok(UserProfileResponse.from(user, documentService.countDocuments(user)));
    }
}
