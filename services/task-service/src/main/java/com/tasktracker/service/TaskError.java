package com.tasktracker.service;

/**
 * Expected failures of task operations.
 */
public enum TaskError {
    VALIDATION(ErrorCategory.VALIDATION),
    NOT_FOUND(ErrorCategory.NOT_FOUND);

    private final ErrorCategory category;

    TaskError(ErrorCategory category) {
        this.category = category;
    }

    public ErrorCategory getCategory() {
        return category;
    }
}
