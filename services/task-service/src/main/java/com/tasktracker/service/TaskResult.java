package com.tasktracker.service;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Outcome of a task operation: a value, or a {@link TaskError} with a client-safe message.
 *
 * @param <T> the success value type
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TaskResult<T> {

    static final String NOT_FOUND_MESSAGE = "Task not found";

    T value;
    TaskError error;
    String message;

    public static <T> TaskResult<T> success(T value) {
        return new TaskResult<>(value, null, null);
    }

    public static <T> TaskResult<T> invalid(String message) {
        return new TaskResult<>(null, TaskError.VALIDATION, message);
    }

    /** Same result for a missing task and for another owner's task. */
    public static <T> TaskResult<T> notFound() {
        return new TaskResult<>(null, TaskError.NOT_FOUND, NOT_FOUND_MESSAGE);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
