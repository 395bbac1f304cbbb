package com.tasktracker.controller;

import com.tasktracker.dto.LoginRequest;
import com.tasktracker.dto.LoginResponse;
import com.tasktracker.dto.RegisterRequest;
import com.tasktracker.security.AuthenticatedUser;
import com.tasktracker.service.AuthResult;
import com.tasktracker.service.AuthService;
import com.tasktracker.web.ErrorResponses;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

/**
 * AuthController - REST API endpoints for authentication operations.
 * 
 * Endpoints:
 * - POST /api/auth/login     - Exchange username/password for a bearer token
 * - POST /api/auth/register  - Create an account and return a bearer token
 * - POST /api/auth/logout    - Acknowledge a client-side logout
 * - GET  /api/auth/session   - Describe the identity behind the caller's token
 * 
 * Security Model:
 * - Stateless authentication using signed JWT bearer tokens
 * - login/register/logout are public; session requires a valid token
 * - Login failures are one generic 401 whatever the cause
 * 
 * Error Handling:
 * - 400 Bad Request: Missing or malformed input
 * - 401 Unauthorized: Invalid credentials, or invalid/expired token on /session
 * - 409 Conflict: Username already registered
 * - 500 Internal Server Error: Database or system failures (GlobalExceptionHandler)
 * 
 * @see AuthService for business logic
 * @see LoginResponse for login response structure
 */
@Slf4j
@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
public class AuthController {

    /** Service layer for authentication business logic */
    private final AuthService authService;

    /**
     * Authenticate a user and issue a token.
     * 
     * @param request Username and password
     * @return 200 with {@link LoginResponse}, or an error body
     */
    @PostMapping("/login")
    public ResponseEntity<?> login(@Valid @RequestBody LoginRequest request) {
        AuthResult result = authService.login(request.getUsername(), request.getPassword());
        if (!result.isSuccess()) {
            return ErrorResponses.of(result.getError().getCategory(), result.getMessage());
        }
        log.info("User {} logged in successfully", result.getUserId());
        return ResponseEntity.ok(toResponse(result));
    }

    /**
     * Register a new account. A successful registration is also a login.
     * 
     * @param request Desired username and password
     * @return 201 with {@link LoginResponse}, or an error body
     */
    @PostMapping("/register")
    public ResponseEntity<?> register(@Valid @RequestBody RegisterRequest request) {
        AuthResult result = authService.register(request.getUsername(), request.getPassword());
        if (!result.isSuccess()) {
            return ErrorResponses.of(result.getError().getCategory(), result.getMessage());
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(result));
    }

    /**
     * Logout the current user.
     * 
     * Tokens are stateless, so there is nothing to invalidate server-side. The client
     * discards its token; the token itself stays valid until it expires.
     * 
     * @return Empty 204 No Content
     */
    @PostMapping("/logout")
    public ResponseEntity<Void> logout() {
        return ResponseEntity.noContent().build();
    }

    /**
     * Get information about the current authenticated session.
     * 
     * The principal is the {@link AuthenticatedUser} bound by the token filter.
     * 
     * @param user Identity resolved from the bearer token
     * @return 200 with session info, or 401 if the account no longer exists
     */
    @GetMapping("/session")
    public ResponseEntity<?> getSession(@AuthenticationPrincipal AuthenticatedUser user) {
        return authService.getSessionInfo(user)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ErrorResponses.of(HttpStatus.UNAUTHORIZED, "Authentication required"));
    }

    private static LoginResponse toResponse(AuthResult result) {
        return LoginResponse.builder()
                .token(result.getToken())
                .userId(result.getUserId())
                .username(result.getUsername())
                .expiresAt(result.getExpiresAt())
                .build();
    }
}
