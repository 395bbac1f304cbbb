package com.tasktracker.service;

import com.tasktracker.entity.User;
import com.tasktracker.security.IssuedToken;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * AuthResult - Outcome of a login or registration attempt.
 * 
 * Either a success carrying the issued token and the resolved identity, or a failure
 * carrying an {@link AuthError} and its message. Two failures with the same error are
 * equal, so every bad-credential outcome is the same value regardless of cause.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AuthResult {

    boolean success;
    String token;
    Instant expiresAt;
    UUID userId;
    String username;
    AuthError error;
    String message;

    public static AuthResult success(IssuedToken issuedToken, User user) {
        return new AuthResult(true, issuedToken.getToken(), issuedToken.getExpiresAt(),
                user.getId(), user.getUsername(), null, null);
    }

    public static AuthResult failure(AuthError error) {
        return failure(error, error.getDefaultMessage());
    }

    public static AuthResult failure(AuthError error, String message) {
        return new AuthResult(false, null, null, null, null, error, message);
    }
}
