package com.tasktracker.service;

import com.tasktracker.config.PasswordProperties;
import com.tasktracker.dto.SessionInfoResponse;
import com.tasktracker.entity.User;
import com.tasktracker.logging.LogSanitizer;
import com.tasktracker.repository.UserRepository;
import com.tasktracker.security.AuthenticatedUser;
import com.tasktracker.security.JwtTokenService;
import com.tasktracker.security.PasswordHasher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * AuthService - Core business logic for login and registration.
 *
 * Login Flow (linear, no internal retries):
 * 1. Blank username -> MISSING_USERNAME, blank password -> MISSING_PASSWORD.
 *    Checked before the user store is touched.
 * 2. Look up the credential record by username.
 *    Unknown username -> INVALID_CREDENTIALS. A placeholder hash is still verified so this
 *    path costs the same as step 3.
 * 3. Verify the password against the stored hash. Mismatch -> INVALID_CREDENTIALS.
 * 4. Issue a token and return it with the user id.
 *
 * Steps 2 and 3 return the very same failure value; callers cannot tell a missing account
 * from a wrong password.
 *
 * Registration Flow:
 * 1. Blank checks as for login, then USERNAME_TOO_LONG, PASSWORD_TOO_SHORT and
 *    PASSWORD_TOO_LONG (over 72 UTF-8 bytes, the BCrypt input limit)
 * 2. USERNAME_TAKEN if the name exists (or a concurrent insert wins the unique constraint)
 * 3. Hash, store, and log the new user in by issuing a token
 *
 * Expected failures are returned as {@link AuthResult} values. Only store faults propagate
 * as exceptions, to be handled at the request boundary.
 *
 * Security Considerations:
 * - Passwords and hashes are never logged
 * - Accounts are logged by id; a client-supplied username only passes through LogSanitizer
 * - Tokens are stateless and short-lived; there is no server-side session to revoke
 *
 * @see PasswordHasher for hashing
 * @see JwtTokenService for token operations
 * @see UserRepository for database operations
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuthService {

    /** Repository for credential records */
    private final UserRepository userRepository;

    private final PasswordHasher passwordHasher;

    private final JwtTokenService tokenService;

    /** Registration policy (minimum password length) */
    private final PasswordProperties passwordProperties;

    /**
     * Authenticate a user with username and password.
     *
     * @param username Login name (case-sensitive)
     * @param password Plaintext password
     * @return success with token and identity, or one of MISSING_USERNAME,
     *         MISSING_PASSWORD, INVALID_CREDENTIALS
     *
     * Example Usage:
     * <pre>
     * AuthResult result = authService.login("alice", "Secr3tPass!");
     * if (result.isSuccess()) {
     *     // result.getToken() -> "eyJhbGciOiJIUzI1NiJ9..."
     * }
     * </pre>
     */
    public AuthResult login(String username, String password) {
        if (isBlank(username)) {
            return AuthResult.failure(AuthError.MISSING_USERNAME);
        }
        if (isBlank(password)) {
            return AuthResult.failure(AuthError.MISSING_PASSWORD);
        }

        Optional<User> user = userRepository.findByUsername(username);
        if (user.isEmpty()) {
            passwordHasher.verifyAgainstPlaceholder(password);
            log.info("Login rejected for unknown username {}", LogSanitizer.sanitize(username));
            return AuthResult.failure(AuthError.INVALID_CREDENTIALS);
        }

        if (!passwordHasher.verify(password, user.get().getPasswordHash())) {
            log.info("Login rejected for user {}", user.get().getId());
            return AuthResult.failure(AuthError.INVALID_CREDENTIALS);
        }

        User authenticated = user.get();
        log.info("User authenticated successfully: {}", authenticated.getId());
        return AuthResult.success(tokenService.issue(authenticated.getId(), authenticated.getUsername()), authenticated);
    }

    /**
     * Create a credential record and log the new user in.
     *
     * Not wrapped in a transaction: the existence check and the insert each run in the
     * repository's own transaction, and a lost race surfaces as a unique-constraint
     * violation on the insert.
     *
     * @param username Desired login name, stored exactly as given
     * @param password Plaintext password, hashed before storage
     * @return success with token and identity, or a validation / USERNAME_TAKEN failure
     */
    public AuthResult register(String username, String password) {
        if (isBlank(username)) {
            return AuthResult.failure(AuthError.MISSING_USERNAME);
        }
        if (isBlank(password)) {
            return AuthResult.failure(AuthError.MISSING_PASSWORD);
        }
        if (username.length() > User.MAX_USERNAME_LENGTH) {
            return AuthResult.failure(AuthError.USERNAME_TOO_LONG);
        }
        int minLength = passwordProperties.minLength();
        if (password.length() < minLength) {
            return AuthResult.failure(AuthError.PASSWORD_TOO_SHORT,
                    "Password must be at least " + minLength + " characters long.");
        }
        if (PasswordHasher.exceedsMaxLength(password)) {
            return AuthResult.failure(AuthError.PASSWORD_TOO_LONG);
        }
        if (userRepository.existsByUsername(username)) {
            return AuthResult.failure(AuthError.USERNAME_TAKEN);
        }

        User newUser = User.builder()
                .username(username)
                .passwordHash(passwordHasher.hash(password))
                .build();
        User saved;
        try {
            saved = userRepository.saveAndFlush(newUser);
        } catch (DataIntegrityViolationException ex) {
            log.info("Registration lost a race for username {}", LogSanitizer.sanitize(username));
            return AuthResult.failure(AuthError.USERNAME_TAKEN);
        }

        log.info("Created new user account {}", saved.getId());
        return AuthResult.success(tokenService.issue(saved.getId(), saved.getUsername()), saved);
    }

    /**
     * Describe the identity bound to the current request.
     *
     * The user is re-read so that a token outliving its account is not reported as a
     * live session.
     *
     * @param user Identity resolved by the token filter
     * @return Session info, or empty if the account no longer exists
     */
    public Optional<SessionInfoResponse> getSessionInfo(AuthenticatedUser user) {
        return userRepository.findById(user.getUserId())
                .map(stored -> SessionInfoResponse.builder()
                        .userId(stored.getId())
                        .username(stored.getUsername())
                        .authenticated(true)
                        .build());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
