package com.tasktracker.service;

import com.tasktracker.dto.TaskRequest;
import com.tasktracker.entity.Task;
import com.tasktracker.entity.TaskStatus;
import com.tasktracker.repository.TaskRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Owner-scoped task operations.
 *
 * <p>Every method takes the acting user's id, which callers obtain from the authenticated
 * principal. Single-task operations match on (id, owner) in one query, so a foreign task
 * yields {@link TaskResult#notFound()} exactly like a missing one.
 *
 * <p>Titles are required and at most {@value #MAX_TITLE_LENGTH} characters; descriptions at
 * most {@value #MAX_DESCRIPTION_LENGTH}. Both are stored trimmed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TaskService {

    static final int MAX_TITLE_LENGTH = 200;
    static final int MAX_DESCRIPTION_LENGTH = 1000;

    private final TaskRepository taskRepository;

    @Transactional(readOnly = true)
    public TaskResult<List<Task>> listByOwner(UUID ownerId) {
        Objects.requireNonNull(ownerId, "ownerId");
        return TaskResult.success(taskRepository.findAllByOwnerIdOrderByCreatedAtDescIdDesc(ownerId));
    }

    @Transactional(readOnly = true)
    public TaskResult<List<Task>> listByStatus(TaskStatus status, UUID ownerId) {
        Objects.requireNonNull(ownerId, "ownerId");
        if (status == null) {
            return TaskResult.invalid("Invalid task status");
        }
        return TaskResult.success(taskRepository.findAllByOwnerIdAndStatusOrderByCreatedAtDescIdDesc(ownerId, status));
    }

    @Transactional(readOnly = true)
    public TaskResult<Task> getById(Long id, UUID ownerId) {
        Objects.requireNonNull(ownerId, "ownerId");
        if (!isValidId(id)) {
            return TaskResult.invalid("Invalid task ID");
        }
        return taskRepository.findByIdAndOwnerId(id, ownerId)
                .map(TaskResult::success)
                .orElseGet(TaskResult::notFound);
    }

    /**
     * Create a task owned by {@code ownerId}. New tasks start in {@link TaskStatus#TODO}.
     */
    @Transactional
    public TaskResult<Task> create(TaskRequest request, UUID ownerId) {
        Objects.requireNonNull(ownerId, "ownerId");
        Optional<String> problem = validate(request);
        if (problem.isPresent()) {
            return TaskResult.invalid(problem.get());
        }

        Task task = Task.builder()
                .title(request.getTitle().trim())
                .description(trimToNull(request.getDescription()))
                .status(TaskStatus.TODO)
                .ownerId(ownerId)
                .build();
        Task saved = taskRepository.save(task);
        log.info("Task {} created by user {}", saved.getId(), ownerId);
        return TaskResult.success(saved);
    }

    @Transactional
    public TaskResult<Task> update(Long id, TaskRequest request, UUID ownerId) {
        Objects.requireNonNull(ownerId, "ownerId");
        if (!isValidId(id)) {
            return TaskResult.invalid("Invalid task ID");
        }
        Optional<String> problem = validate(request);
        if (problem.isPresent()) {
            return TaskResult.invalid(problem.get());
        }

        Optional<Task> existing = taskRepository.findByIdAndOwnerId(id, ownerId);
        if (existing.isEmpty()) {
            return TaskResult.notFound();
        }
        Task task = existing.get();
        task.setTitle(request.getTitle().trim());
        task.setDescription(trimToNull(request.getDescription()));
        return TaskResult.success(taskRepository.save(task));
    }

    @Transactional
    public TaskResult<Task> updateStatus(Long id, TaskStatus status, UUID ownerId) {
        Objects.requireNonNull(ownerId, "ownerId");
        if (!isValidId(id)) {
            return TaskResult.invalid("Invalid task ID");
        }
        if (status == null) {
            return TaskResult.invalid("Invalid task status");
        }

        Optional<Task> existing = taskRepository.findByIdAndOwnerId(id, ownerId);
        if (existing.isEmpty()) {
            return TaskResult.notFound();
        }
        Task task = existing.get();
        task.setStatus(status);
        return TaskResult.success(taskRepository.save(task));
    }

    /**
     * @return success carrying the deleted id, or not-found if nothing of this owner matched
     */
    @Transactional
    public TaskResult<Long> delete(Long id, UUID ownerId) {
        Objects.requireNonNull(ownerId, "ownerId");
        if (!isValidId(id)) {
            return TaskResult.invalid("Invalid task ID");
        }
        if (taskRepository.deleteByIdAndOwnerId(id, ownerId) == 0) {
            return TaskResult.notFound();
        }
        log.info("Task {} deleted by user {}", id, ownerId);
        return TaskResult.success(id);
    }

    private static Optional<String> validate(TaskRequest request) {
        if (request == null || request.getTitle() == null || request.getTitle().isBlank()) {
            return Optional.of("Task title is required");
        }
        if (request.getTitle().trim().length() > MAX_TITLE_LENGTH) {
            return Optional.of("Task title cannot exceed " + MAX_TITLE_LENGTH + " characters");
        }
        String description = request.getDescription();
        if (description != null && description.trim().length() > MAX_DESCRIPTION_LENGTH) {
            return Optional.of("Task description cannot exceed " + MAX_DESCRIPTION_LENGTH + " characters");
        }
        return Optional.empty();
    }

    private static boolean isValidId(Long id) {
        return id != null && id > 0;
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
