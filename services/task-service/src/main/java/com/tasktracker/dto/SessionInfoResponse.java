package com.tasktracker.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * SessionInfoResponse - Identity the server resolved from the caller's token.
 * 
 * Example Response:
 * <pre>
 * {
 *   "userId": "123e4567-e89b-12d3-a456-426614174000",
 *   "username": "alice",
 *   "authenticated": true
 * }
 * </pre>
 * 
 * Called by: GET /api/auth/session, on app load to decide whether to show the login page.
 * 
 * @see com.tasktracker.controller.AuthController#getSession
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionInfoResponse {

    private UUID userId;

    private String username;

    /**
     * Always true when returned; an invalid token is answered with 401 instead.
     */
    private boolean authenticated;
}
