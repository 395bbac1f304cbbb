package com.tasktracker.service;

import com.tasktracker.config.SeedProperties;
import com.tasktracker.config.SeedProperties.SeedTask;
import com.tasktracker.config.SeedProperties.SeedUser;
import com.tasktracker.dto.TaskRequest;
import com.tasktracker.entity.Task;
import com.tasktracker.entity.TaskStatus;
import com.tasktracker.entity.User;
import com.tasktracker.repository.UserRepository;
import com.tasktracker.security.PasswordHasher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * DatabaseSeeder - Creates the configured demo accounts and tasks at startup.
 *
 * Only registered when seed.enabled=true, and only acts on a database without users, so a
 * restart never duplicates data.
 *
 * Seeded data takes the same paths as live requests:
 * - passwords are hashed by {@link PasswordHasher}
 * - tasks are created through {@link TaskService} with the seeded account as owner, then
 *   moved to their configured status
 *
 * A seed entry the service rejects (bad title, unhashable password) fails startup.
 *
 * @see SeedProperties for the seed.* settings
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "seed", name = "enabled", havingValue = "true")
public class DatabaseSeeder implements ApplicationRunner {

    private final SeedProperties seedProperties;
    private final UserRepository userRepository;
    private final PasswordHasher passwordHasher;
    private final TaskService taskService;

    @Override
    public void run(ApplicationArguments args) {
        if (userRepository.count() > 0) {
            log.info("Database seeding skipped: users already present");
            return;
        }

        log.info("Seeding {} user(s)", seedProperties.users().size());
        for (SeedUser seedUser : seedProperties.users()) {
            User user = userRepository.saveAndFlush(User.builder()
                    .username(seedUser.username())
                    .passwordHash(passwordHasher.hash(seedUser.password()))
                    .build());
            for (SeedTask seedTask : seedUser.tasks()) {
                seedTask(seedTask, user.getId());
            }
            log.info("Seeded user {} with {} task(s)", user.getId(), seedUser.tasks().size());
        }
        log.info("Database seeding completed");
    }

    private void seedTask(SeedTask seedTask, UUID ownerId) {
        Task task = requireSuccess(
                taskService.create(new TaskRequest(seedTask.title(), seedTask.description()), ownerId), seedTask);
        if (seedTask.status() != TaskStatus.TODO) {
            requireSuccess(taskService.updateStatus(task.getId(), seedTask.status(), ownerId), seedTask);
        }
    }

    private static <T> T requireSuccess(TaskResult<T> result, SeedTask seedTask) {
        if (!result.isSuccess()) {
            throw new IllegalStateException(
                    "Seed task '" + seedTask.title() + "' rejected: " + result.getMessage());
        }
        return result.getValue();
    }
}
