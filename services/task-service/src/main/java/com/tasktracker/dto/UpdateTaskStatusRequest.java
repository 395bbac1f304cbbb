package com.tasktracker.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of {@code PATCH /api/tasks/{id}/status}.
 *
 * <p>The status is read with {@link com.tasktracker.entity.TaskStatus#parse}, the same rule as
 * the {@code /api/tasks/status/{status}} filter: a label ({@code InProgress}) or a constant name
 * ({@code IN_PROGRESS}), ignoring case.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UpdateTaskStatusRequest {

    @NotBlank(message = "Status is required")
    private String status;
}
