package com.tasktracker.controller;

import com.tasktracker.dto.TaskRequest;
import com.tasktracker.dto.TaskResponse;
import com.tasktracker.dto.UpdateTaskStatusRequest;
import com.tasktracker.entity.Task;
import com.tasktracker.entity.TaskStatus;
import com.tasktracker.security.AuthenticatedUser;
import com.tasktracker.service.TaskResult;
import com.tasktracker.service.TaskService;
import com.tasktracker.web.ErrorResponses;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

import java.net.URI;
import java.util.List;
import java.util.Optional;

/**
 * Task endpoints. Every handler takes the owner from the authenticated principal; no
 * request body or path carries an owner id.
 *
 * <p>A task owned by another user answers 404 with the same body as a missing task.
 */
@RestController
@RequestMapping("/api/tasks")
@RequiredArgsConstructor
public class TaskController {

    static final String INVALID_STATUS_MESSAGE =
            "Invalid status parameter. Valid values are: " + TaskStatus.labels();

    private final TaskService taskService;

    @GetMapping
    public ResponseEntity<?> listTasks(@AuthenticationPrincipal AuthenticatedUser user) {
        return toListResponse(taskService.listByOwner(user.getUserId()));
    }

    @GetMapping("/status/{status}")
    public ResponseEntity<?> listTasksByStatus(
            @PathVariable String status, @AuthenticationPrincipal AuthenticatedUser user) {
        Optional<TaskStatus> parsed = TaskStatus.parse(status);
        if (parsed.isEmpty()) {
            return ErrorResponses.of(HttpStatus.BAD_REQUEST, INVALID_STATUS_MESSAGE);
        }
        return toListResponse(taskService.listByStatus(parsed.get(), user.getUserId()));
    }

    @GetMapping("/{id}")
    public ResponseEntity<?> getTask(@PathVariable Long id, @AuthenticationPrincipal AuthenticatedUser user) {
        return toResponse(taskService.getById(id, user.getUserId()), HttpStatus.OK);
    }

    @PostMapping
    public ResponseEntity<?> createTask(
            @Valid @RequestBody TaskRequest request, @AuthenticationPrincipal AuthenticatedUser user) {
        TaskResult<Task> result = taskService.create(request, user.getUserId());
        if (!result.isSuccess()) {
            return ErrorResponses.of(result.getError().getCategory(), result.getMessage());
        }
        URI location = ServletUriComponentsBuilder.fromCurrentRequest()
                .path("/{id}")
                .buildAndExpand(result.getValue().getId())
                .toUri();
        return ResponseEntity.created(location).body(TaskResponse.from(result.getValue()));
    }

    @PutMapping("/{id}")
    public ResponseEntity<?> updateTask(
            @PathVariable Long id,
            @Valid @RequestBody TaskRequest request,
            @AuthenticationPrincipal AuthenticatedUser user) {
        return toResponse(taskService.update(id, request, user.getUserId()), HttpStatus.OK);
    }

    @PatchMapping("/{id}/status")
    public ResponseEntity<?> updateTaskStatus(
            @PathVariable Long id,
            @Valid @RequestBody UpdateTaskStatusRequest request,
            @AuthenticationPrincipal AuthenticatedUser user) {
        Optional<TaskStatus> status = TaskStatus.parse(request.getStatus());
        if (status.isEmpty()) {
            return ErrorResponses.of(HttpStatus.BAD_REQUEST, INVALID_STATUS_MESSAGE);
        }
        return toResponse(taskService.updateStatus(id, status.get(), user.getUserId()), HttpStatus.OK);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<?> deleteTask(@PathVariable Long id, @AuthenticationPrincipal AuthenticatedUser user) {
        TaskResult<Long> result = taskService.delete(id, user.getUserId());
        if (!result.isSuccess()) {
            return ErrorResponses.of(result.getError().getCategory(), result.getMessage());
        }
        return ResponseEntity.noContent().build();
    }

    private static ResponseEntity<?> toResponse(TaskResult<Task> result, HttpStatus status) {
        if (!result.isSuccess()) {
            return ErrorResponses.of(result.getError().getCategory(), result.getMessage());
        }
        return ResponseEntity.status(status).body(TaskResponse.from(result.getValue()));
    }

    private static ResponseEntity<?> toListResponse(TaskResult<List<Task>> result) {
        if (!result.isSuccess()) {
            return ErrorResponses.of(result.getError().getCategory(), result.getMessage());
        }
        List<TaskResponse> tasks = result.getValue().stream().map(TaskResponse::from).toList();
        return ResponseEntity.ok(tasks);
    }
}
