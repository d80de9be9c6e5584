package com.skynet.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.skynet.config.SecurityConfig;
import com.skynet.dto.request.LoginRequest;
import com.skynet.dto.request.SignupRequest;
import com.skynet.dto.request.VerifyOtpRequest;
import com.skynet.entity.User;
import com.skynet.exception.AccountError;
import com.skynet.exception.AccountException;
import com.skynet.security.JwtAuthenticationEntryPoint;
import com.skynet.security.JwtTokenProvider;
import com.skynet.service.AccountResult;
import com.skynet.service.AccountService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Clock;
import java.time.Duration;
import java.util.UUID;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.user;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Web layer tests for AuthController.
 *
 * Verifies request validation, the mapping of account errors to HTTP statuses and
 * that logout requires a bearer token.
 */
@WebMvcTest(AuthController.class)
@Import({SecurityConfig.class, JwtAuthenticationEntryPoint.class})
@ActiveProfiles("test")
@DisplayName("AuthController Web Tests")
class AuthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private AccountService accountService;

    @MockBean
    private JwtTokenProvider jwtTokenProvider;

    @MockBean
    private CurrentAccountResolver currentAccountResolver;

    @MockBean
    private Clock clock;

    private User alice;

    @BeforeEach
    void setUp() {
        alice = new User("alice", "a@x.com", "Alice A", "digest");
        alice.setId(UUID.randomUUID());
    }

    @Test
    @DisplayName("POST /auth/signup should answer 201 with the normalized email")
    void testSignup_Created() throws Exception {
        when(accountService.signup("alice", "A@x.com", "Alice A", "password123"))
                .thenReturn(AccountResult.success(alice));

        mockMvc.perform(post("/auth/signup")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(
                                new SignupRequest("alice", "A@x.com", "Alice A", "password123"))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.email").value("a@x.com"))
                .andExpect(jsonPath("$.message").value(AuthController.SIGNUP_MESSAGE));
    }

    @Test
    @DisplayName("POST /auth/signup with a taken email should answer 400 CONFLICT")
    void testSignup_Conflict() throws Exception {
        when(accountService.signup(anyString(), anyString(), anyString(), anyString()))
                .thenReturn(AccountResult.failure(AccountError.CONFLICT));

        mockMvc.perform(post("/auth/signup")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(
                                new SignupRequest("alice", "a@x.com", "Alice A", "password123"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("CONFLICT"))
                .andExpect(jsonPath("$.detail").value("Email or username already registered"));
    }

    @Test
    @DisplayName("POST /auth/signup with a short password should fail validation")
    void testSignup_ShortPassword() throws Exception {
        mockMvc.perform(post("/auth/signup")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(
                                new SignupRequest("alice", "a@x.com", "Alice A", "short"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors.password").exists());

        verify(accountService, never()).signup(anyString(), anyString(), anyString(), anyString());
    }

    @Test
    @DisplayName("POST /auth/verify-otp should map NOT_FOUND to 404 and EXPIRED to 400")
    void testVerifyOtp_ErrorMapping() throws Exception {
        when(accountService.verifyOtp("nobody@x.com", "123456"))
                .thenReturn(AccountResult.failure(AccountError.NOT_FOUND));
        when(accountService.verifyOtp("a@x.com", "123456"))
                .thenReturn(AccountResult.failure(AccountError.EXPIRED));

        mockMvc.perform(post("/auth/verify-otp")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new VerifyOtpRequest("nobody@x.com", "123456"))))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").value("NOT_FOUND"));

        mockMvc.perform(post("/auth/verify-otp")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new VerifyOtpRequest("a@x.com", "123456"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("OTP has expired. Please request a new one."));
    }

    @Test
    @DisplayName("POST /auth/verify-otp should return the verified user")
    void testVerifyOtp_Success() throws Exception {
        alice.activate();
        when(accountService.verifyOtp("a@x.com", "123456")).thenReturn(AccountResult.success(alice));

        mockMvc.perform(post("/auth/verify-otp")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new VerifyOtpRequest("a@x.com", "123456"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.user.id").value(alice.getId().toString()))
                .andExpect(jsonPath("$.user.username").value("alice"))
                .andExpect(jsonPath("$.user.hashedPassword").doesNotExist());
    }

    @Test
    @DisplayName("POST /auth/login should return a bearer token")
    void testLogin_Success() throws Exception {
        when(accountService.login("a@x.com", "password123")).thenReturn(AccountResult.success("jwt-token"));
        when(jwtTokenProvider.getTokenTtl()).thenReturn(Duration.ofMinutes(30));

        mockMvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new LoginRequest("a@x.com", "password123"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.accessToken").value("jwt-token"))
                .andExpect(jsonPath("$.tokenType").value("bearer"))
                .andExpect(jsonPath("$.expiresIn").value(1800));
    }

    @Test
    @DisplayName("POST /auth/login should map INVALID_CREDENTIALS to 401 and NOT_VERIFIED to 403")
    void testLogin_ErrorMapping() throws Exception {
        when(accountService.login("a@x.com", "wrong-password"))
                .thenReturn(AccountResult.failure(AccountError.INVALID_CREDENTIALS));
        when(accountService.login("pending@x.com", "password123"))
                .thenReturn(AccountResult.failure(AccountError.NOT_VERIFIED));

        mockMvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new LoginRequest("a@x.com", "wrong-password"))))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.detail").value("Invalid email or password"));

        mockMvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new LoginRequest("pending@x.com", "password123"))))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.errorCode").value("NOT_VERIFIED"));
    }

    @Test
    @DisplayName("POST /auth/logout without a token should answer 401")
    void testLogout_NoToken() throws Exception {
        mockMvc.perform(post("/auth/logout"))
                .andExpect(status().isUnauthorized())
                .andExpect(header().string("WWW-Authenticate", "Bearer"));

        verify(currentAccountResolver, never()).require(any());
    }

    @Test
    @DisplayName("POST /auth/logout with an unusable bearer token should answer 401 invalid_token")
    void testLogout_InvalidToken() throws Exception {
        mockMvc.perform(post("/auth/logout").header("Authorization", "Bearer not-a-token"))
                .andExpect(status().isUnauthorized())
                .andExpect(header().string("WWW-Authenticate", containsString("invalid_token")))
                .andExpect(jsonPath("$.errorCode").value("UNAUTHENTICATED"));
    }

    @Test
    @DisplayName("POST /auth/logout with an authenticated account should confirm the identity")
    void testLogout_Authenticated() throws Exception {
        alice.activate();
        when(currentAccountResolver.require(any())).thenReturn(alice);

        mockMvc.perform(post("/auth/logout").with(user(alice.getId().toString())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value(AuthController.LOGOUT_MESSAGE))
                .andExpect(jsonPath("$.user.email").value("a@x.com"));
    }

    @Test
    @DisplayName("POST /auth/logout for a deactivated account should answer 403")
    void testLogout_Deactivated() throws Exception {
        when(currentAccountResolver.require(any())).thenThrow(new AccountException(AccountError.DEACTIVATED));

        mockMvc.perform(post("/auth/logout").with(user(alice.getId().toString())))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.errorCode").value("DEACTIVATED"));
    }
}
