package com.tasktracker.security;

import com.tasktracker.config.PasswordProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * PasswordHasher - One-way adaptive hashing and verification of user passwords.
 * 
 * Uses BCrypt with a configurable cost (auth.password.work-factor, default 12).
 * Every hash is self-describing and carries its own random salt:
 * <pre>
 * $2a$12$R9h/cIPz0gi.URNNX3kh2OPST9/PgBkqquzi.Ss7KIUgO2t0jWMUW
 *  |  |  |                     |
 *  |  |  salt (22 chars)       digest (31 chars)
 *  |  cost
 *  version
 * </pre>
 * 
 * Contract:
 * - hash() rejects null, empty and whitespace-only input with IllegalArgumentException
 * - hash() rejects input longer than 72 UTF-8 bytes, the most BCrypt reads; verify()
 *   returns false for such input so two passwords sharing a 72-byte prefix never match
 * - hash() called twice on the same input returns two different values
 * - verify() never throws; malformed hashes, blank inputs and mismatches all return false
 * - verify() compares digests in constant time (BCrypt.checkpw)
 * 
 * Thread Safety:
 * Immutable after construction. BCryptPasswordEncoder holds no per-call state and is
 * shared across request threads.
 * 
 * @see com.tasktracker.service.AuthService for login and registration
 */
@Slf4j
@Component
public class PasswordHasher {

    /** BCrypt ignores every byte after the 72nd. */
    public static final int MAX_PASSWORD_BYTES = 72;

    /** Input used to build the placeholder hash for {@link #verifyAgainstPlaceholder}. */
    private static final String PLACEHOLDER_SECRET = "placeholder-credential";

    private final BCryptPasswordEncoder encoder;

    /**
     * Hash with the configured cost that unknown-user logins are checked against, so a
     * lookup miss spends the same CPU time as a wrong password.
     */
    private final String placeholderHash;

    public PasswordHasher(PasswordProperties properties) {
        this.encoder = new BCryptPasswordEncoder(properties.workFactor());
        this.placeholderHash = encoder.encode(PLACEHOLDER_SECRET);
        log.info("Password hasher initialised with BCrypt cost {}", properties.workFactor());
    }

    /**
     * Hash a plaintext password with a fresh salt.
     * 
     * @param plaintext The password as typed by the user
     * @return BCrypt hash string (60 characters)
     * @throws IllegalArgumentException if the password is null, empty, whitespace-only or
     *                                  longer than {@value #MAX_PASSWORD_BYTES} UTF-8 bytes
     */
    public String hash(String plaintext) {
        if (plaintext == null || plaintext.isBlank()) {
            throw new IllegalArgumentException("Password cannot be null or empty");
        }
        if (exceedsMaxLength(plaintext)) {
            throw new IllegalArgumentException(
                    "Password cannot exceed " + MAX_PASSWORD_BYTES + " bytes");
        }
        return encoder.encode(plaintext);
    }

    /**
     * Check a plaintext password against a stored hash.
     * 
     * @param plaintext The candidate password
     * @param hash The stored BCrypt hash
     * @return true only if the password matches; false for any other outcome
     */
    public boolean verify(String plaintext, String hash) {
        if (plaintext == null || plaintext.isBlank() || hash == null || hash.isBlank()) {
            return false;
        }
        if (exceedsMaxLength(plaintext)) {
            return false;
        }
        try {
            return encoder.matches(plaintext, hash);
        } catch (RuntimeException ex) {
            log.debug("Password verification failed on unreadable hash: {}", ex.getClass().getSimpleName());
            return false;
        }
    }

    /**
     * Run a full verification whose result is discarded.
     * 
     * Called on the unknown-username path of login.
     * 
     * @param plaintext The candidate password (may be anything non-blank)
     */
    public void verifyAgainstPlaceholder(String plaintext) {
        verify(plaintext, placeholderHash);
    }

    /**
     * @return true if the password is longer than BCrypt can hash in full
     */
    public static boolean exceedsMaxLength(String plaintext) {
        return plaintext.getBytes(StandardCharsets.UTF_8).length > MAX_PASSWORD_BYTES;
    }
}
