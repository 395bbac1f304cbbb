package com.tasktracker.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Password hashing and policy settings, bound from {@code auth.password.*}.
 *
 * @param workFactor BCrypt cost (log2 rounds). Defaults to 12.
 * @param minLength minimum password length accepted at registration. Defaults to 6.
 */
@ConfigurationProperties(prefix = "auth.password")
@Validated
public record PasswordProperties(
        @Min(4) @Max(31) int workFactor,
        @Min(1) int minLength) {

    public static final int DEFAULT_WORK_FACTOR = 12;
    public static final int DEFAULT_MIN_LENGTH = 6;

    public PasswordProperties {
        if (workFactor == 0) {
            workFactor = DEFAULT_WORK_FACTOR;
        }
        if (minLength == 0) {
            minLength = DEFAULT_MIN_LENGTH;
        }
    }

    public static PasswordProperties defaults() {
        return new PasswordProperties(DEFAULT_WORK_FACTOR, DEFAULT_MIN_LENGTH);
    }
}
