package com.tasktracker.security;

import com.tasktracker.config.JwtProperties;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * JwtTokenService - Issues and validates the service's signed bearer tokens.
 *
 * JWT Structure (RFC 7519):
 * - Header: {"alg":"HS256"}
 * - Payload: sub (user id), username, iss, aud, iat, exp
 * - Signature: HMAC-SHA256 over header and payload with the configured secret
 *
 * Configuration (application.yml, see {@link JwtProperties}):
 * - jwt.secret: signing secret, at least 32 bytes
 * - jwt.issuer / jwt.audience: written at issuance, required at validation
 * - jwt.expiration-minutes: token lifetime
 * - jwt.clock-skew-seconds: tolerance on exp (0 = none)
 *
 * A token is accepted only if ALL of the following hold:
 * 1. the signature verifies under the current secret
 * 2. iss and aud equal the configured values
 * 3. the current time is strictly before exp (+ skew)
 *
 * Failure Policy:
 * validate(), subjectOf() and resolve() fail closed. Malformed input, a bad signature,
 * a wrong issuer or audience, or an expired token all produce false/empty. Nothing is
 * thrown to the caller and no claim is ever read from a token that failed validation.
 *
 * Statelessness:
 * No token is stored server-side. Expiry is the only way a token stops working; logout
 * is the client discarding it.
 *
 * Thread Safety:
 * The key, parser and settings are fixed at construction and shared by all request threads.
 *
 * @see JwtAuthenticationFilter for per-request validation
 * @see com.tasktracker.service.AuthService for issuance
 */
@Slf4j
@Component
public class JwtTokenService {

    /** Claim carrying the display name. */
    public static final String USERNAME_CLAIM = "username";

    private final SecretKey signingKey;
    private final String issuer;
    private final String audience;
    private final Duration lifetime;
    private final Duration clockSkew;
    private final Clock clock;
    private final JwtParser parser;

    /**
     * Build the service and check its configuration.
     *
     * @param properties Bound jwt.* settings
     * @param clock Source of "now" for iat, exp and expiry checks
     * @throws IllegalStateException if the secret is missing or shorter than 32 bytes,
     *                               or issuer/audience are blank
     */
    public JwtTokenService(JwtProperties properties, Clock clock) {
        this.signingKey = signingKeyFor(properties.secret());
        this.issuer = requireText(properties.issuer(), "jwt.issuer");
        this.audience = requireText(properties.audience(), "jwt.audience");
        this.lifetime = Duration.ofMinutes(properties.expirationMinutes());
        this.clockSkew = Duration.ofSeconds(properties.clockSkewSeconds());
        this.clock = clock;
        this.parser = Jwts.parserBuilder()
                .setSigningKey(signingKey)
                .requireIssuer(issuer)
                .requireAudience(audience)
                .setAllowedClockSkewSeconds(properties.clockSkewSeconds())
                .setClock(() -> Date.from(clock.instant()))
                .build();
        log.info("Token service ready: issuer={}, audience={}, lifetime={}, clockSkew={}",
                issuer, audience, lifetime, clockSkew);
    }

    /**
     * Derive the HMAC key from the configured secret.
     *
     * The length check runs here rather than inside Keys.hmacShaKeyFor so a weak secret
     * surfaces as a configuration error naming the property.
     */
    private static SecretKey signingKeyFor(String secret) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("jwt.secret must be configured");
        }
        byte[] keyBytes = secret.getBytes(StandardCharsets.UTF_8);
        if (keyBytes.length < JwtProperties.MIN_SECRET_LENGTH) {
            throw new IllegalStateException(
                    "jwt.secret must be at least " + JwtProperties.MIN_SECRET_LENGTH + " bytes long");
        }
        return Keys.hmacShaKeyFor(keyBytes);
    }

    private static String requireText(String value, String property) {
        if (value == null || value.isBlank()) {
            throw new IllegalStateException(property + " must be configured");
        }
        return value;
    }

    /**
     * Issue a signed token for an authenticated user.
     *
     * iat and exp are truncated to whole seconds, the precision JWT NumericDate carries,
     * so {@link IssuedToken#getExpiresAt()} equals the exp inside the token.
     *
     * @param userId Subject of the token
     * @param username Display name written to the username claim
     * @return Compact token plus its expiry instant
     */
    public IssuedToken issue(UUID userId, String username) {
        Objects.requireNonNull(userId, "userId");
        Instant issuedAt = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        Instant expiresAt = issuedAt.plus(lifetime);

        String token = Jwts.builder()
                .setSubject(userId.toString())
                .claim(USERNAME_CLAIM, username)
                .setIssuer(issuer)
                .setAudience(audience)
                .setIssuedAt(Date.from(issuedAt))
                .setExpiration(Date.from(expiresAt))
                .signWith(signingKey, SignatureAlgorithm.HS256)
                .compact();
        return new IssuedToken(token, expiresAt);
    }

    /**
     * @param token Compact JWS, may be null
     * @return true if the token passes signature, issuer, audience and expiry checks
     */
    public boolean validate(String token) {
        return parseClaims(token).isPresent();
    }

    /**
     * Resolve the user id carried by a valid token.
     *
     * @param token Compact JWS, may be null
     * @return The subject as a UUID; empty if the token is invalid or the subject is not a UUID
     */
    public Optional<UUID> subjectOf(String token) {
        return parseClaims(token).flatMap(JwtTokenService::subjectAsUuid);
    }

    /**
     * Resolve the full identity (id and display name) carried by a valid token.
     *
     * @param token Compact JWS, may be null
     * @return The identity, or empty under the same conditions as {@link #subjectOf}
     */
    public Optional<AuthenticatedUser> resolve(String token) {
        return parseClaims(token).flatMap(claims -> subjectAsUuid(claims)
                .map(userId -> new AuthenticatedUser(userId, usernameOf(claims))));
    }

    public Duration getLifetime() {
        return lifetime;
    }

    private Optional<Claims> parseClaims(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        try {
            Claims claims = parser.parseClaimsJws(token).getBody();
            // exp is required; the parser alone would accept a token without one
            Date expiration = claims.getExpiration();
            if (expiration == null
                    || !clock.instant().isBefore(expiration.toInstant().plus(clockSkew))) {
                return Optional.empty();
            }
            return Optional.of(claims);
        } catch (JwtException | IllegalArgumentException ex) {
            log.debug("Token rejected: {}", ex.getClass().getSimpleName());
            return Optional.empty();
        } catch (RuntimeException ex) {
            log.warn("Unexpected error while validating token", ex);
            return Optional.empty();
        }
    }

    private static Optional<UUID> subjectAsUuid(Claims claims) {
        String subject = claims.getSubject();
        if (subject == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(UUID.fromString(subject));
        } catch (IllegalArgumentException ex) {
            log.debug("Token subject is not a user id");
            return Optional.empty();
        }
    }

    private static String usernameOf(Claims claims) {
        Object username = claims.get(USERNAME_CLAIM);
        return username instanceof String ? (String) username : null;
    }
}
