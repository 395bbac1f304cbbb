package com.tasktracker.service;

/**
 * Coarse class of an expected failure. Controllers map each category to one HTTP status.
 */
public enum ErrorCategory {
    /** Missing or malformed input, detected before any store access. */
    VALIDATION,
    /** Bad credentials. Never says which part was wrong or whether the account exists. */
    AUTHENTICATION,
    /** Absent, or owned by someone else; the two are deliberately the same outcome. */
    NOT_FOUND,
    /** Request conflicts with existing state (username taken). */
    CONFLICT
}
