package com.tasktracker.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Token signing and validation settings, bound from the {@code jwt.*} prefix.
 *
 * <p>Bound and validated at startup. An absent or short secret stops the context from
 * starting:
 *
 * <pre>
 * jwt:
 *   secret: ${JWT_SECRET}
 *   issuer: task-tracker
 *   audience: task-tracker-clients
 *   expiration-minutes: 60
 *   clock-skew-seconds: 0
 * </pre>
 *
 * @param secret HMAC-SHA256 signing secret, at least {@value #MIN_SECRET_LENGTH} characters.
 * @param issuer value written to and required in the {@code iss} claim.
 * @param audience value written to and required in the {@code aud} claim.
 * @param expirationMinutes token lifetime (default 60).
 * @param clockSkewSeconds tolerance applied to {@code exp} when validating (default 0).
 */
@ConfigurationProperties(prefix = "jwt")
@Validated
public record JwtProperties(
        @NotBlank @Size(min = JwtProperties.MIN_SECRET_LENGTH) String secret,
        @NotBlank String issuer,
        @NotBlank String audience,
        long expirationMinutes,
        @PositiveOrZero long clockSkewSeconds) {

    /** HS256 needs a key of at least 256 bits. */
    public static final int MIN_SECRET_LENGTH = 32;

    public JwtProperties {
        if (expirationMinutes <= 0) {
            expirationMinutes = 60;
        }
    }
}
