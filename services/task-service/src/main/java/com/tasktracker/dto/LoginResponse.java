package com.tasktracker.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * LoginResponse - Data Transfer Object for successful login and registration.
 * 
 * Example Response:
 * <pre>
 * {
 *   "token": "eyJhbGciOiJIUzI1NiJ9.eyJzdWIiOi...",
 *   "userId": "123e4567-e89b-12d3-a456-426614174000",
 *   "username": "alice",
 *   "expiresAt": "2024-01-15T10:30:00Z"
 * }
 * </pre>
 * 
 * Frontend Usage:
 * 1. Send the token as "Authorization: Bearer <token>" on every further call
 * 2. Discard the token on logout or once expiresAt has passed
 * 
 * @see com.tasktracker.controller.AuthController#login
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LoginResponse {

    /** Signed bearer token. */
    private String token;

    /**
     * Unique identifier for the authenticated user.
     * 
     * A public identifier, not a secret; authorization relies on the token.
     */
    private UUID userId;

    private String username;

    /**
     * Instant the token stops being accepted, identical to its exp claim.
     * 
     * Format: ISO 8601 UTC instant (e.g., "2024-01-15T10:30:00Z")
     */
    private Instant expiresAt;
}
