package com.tasktracker.service;

/**
 * Expected failures of login and registration, each with a client-safe message.
 */
public enum AuthError {
    MISSING_USERNAME(ErrorCategory.VALIDATION, "Username is required."),
    MISSING_PASSWORD(ErrorCategory.VALIDATION, "Password is required."),
    USERNAME_TOO_LONG(ErrorCategory.VALIDATION, "Username cannot exceed 100 characters."),
    PASSWORD_TOO_SHORT(ErrorCategory.VALIDATION, "Password is too short."),
    PASSWORD_TOO_LONG(ErrorCategory.VALIDATION, "Password cannot exceed 72 bytes."),
    INVALID_CREDENTIALS(ErrorCategory.AUTHENTICATION, "Invalid username or password."),
    USERNAME_TAKEN(ErrorCategory.CONFLICT, "Username already exists.");

    private final ErrorCategory category;
    private final String defaultMessage;

    AuthError(ErrorCategory category, String defaultMessage) {
        this.category = category;
        this.defaultMessage = defaultMessage;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}
