package com.tasktracker.entity;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Workflow state of a task. Stored by name, exchanged with clients by label.
 */
public enum TaskStatus {
    TODO("ToDo"),
    IN_PROGRESS("InProgress"),
    COMPLETED("Completed");

    private final String label;

    TaskStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    /**
     * Parse a client-supplied status. Accepts the label ({@code InProgress}) or the constant
     * name ({@code IN_PROGRESS}), ignoring case.
     */
    public static Optional<TaskStatus> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String candidate = value.strip();
        return Arrays.stream(values())
                .filter(status -> status.label.equalsIgnoreCase(candidate) || status.name().equalsIgnoreCase(candidate))
                .findFirst();
    }

    /** Labels joined for error messages, e.g. "ToDo, InProgress, Completed". */
    public static String labels() {
        return String.join(", ", Arrays.stream(values()).map(TaskStatus::getLabel).toList());
    }
}
