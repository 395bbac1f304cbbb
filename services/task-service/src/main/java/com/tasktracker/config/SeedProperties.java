package com.tasktracker.config;

import com.tasktracker.entity.TaskStatus;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * Demo data created at startup on an empty database, bound from {@code seed.*}.
 *
 * <pre>
 * seed:
 *   enabled: true
 *   users:
 *     - username: admin
 *       password: password123
 *       tasks:
 *         - title: Implement Authentication
 *           status: InProgress
 * </pre>
 *
 * @param enabled whether {@link com.tasktracker.service.DatabaseSeeder} runs at all (default false).
 * @param users accounts to create, each with its own tasks.
 */
@ConfigurationProperties(prefix = "seed")
@Validated
public record SeedProperties(boolean enabled, @Valid List<SeedUser> users) {

    public SeedProperties {
        users = users == null ? List.of() : List.copyOf(users);
    }

    /**
     * @param username login name of the seeded account.
     * @param password plaintext, hashed before storage.
     * @param tasks tasks owned by this account.
     */
    public record SeedUser(@NotBlank String username, @NotBlank String password, @Valid List<SeedTask> tasks) {

        public SeedUser {
            tasks = tasks == null ? List.of() : List.copyOf(tasks);
        }
    }

    /**
     * @param title task title.
     * @param description optional description.
     * @param status initial status (default {@link TaskStatus#TODO}).
     */
    public record SeedTask(@NotBlank String title, String description, TaskStatus status) {

        public SeedTask {
            if (status == null) {
                status = TaskStatus.TODO;
            }
        }
    }
}
