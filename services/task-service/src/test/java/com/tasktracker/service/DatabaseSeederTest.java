package com.tasktracker.service;

import com.tasktracker.config.PasswordProperties;
import com.tasktracker.config.SeedProperties;
import com.tasktracker.config.SeedProperties.SeedTask;
import com.tasktracker.config.SeedProperties.SeedUser;
import com.tasktracker.dto.TaskRequest;
import com.tasktracker.entity.Task;
import com.tasktracker.entity.TaskStatus;
import com.tasktracker.entity.User;
import com.tasktracker.repository.UserRepository;
import com.tasktracker.security.PasswordHasher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@DisplayName("DatabaseSeeder")
class DatabaseSeederTest {

    @Configuration(proxyBeanMethods = false)
    @EnableConfigurationProperties(SeedProperties.class)
    @Import(DatabaseSeeder.class)
    static class SeederConfiguration {
    }

    @Nested
    @DisplayName("activation")
    class Activation {

        private final ApplicationContextRunner runner = new ApplicationContextRunner()
                .withUserConfiguration(SeederConfiguration.class)
                .withBean(UserRepository.class, () -> mock(UserRepository.class))
                .withBean(PasswordHasher.class, () -> mock(PasswordHasher.class))
                .withBean(TaskService.class, () -> mock(TaskService.class));

        @Test
        @DisplayName("is skipped when seed.enabled is not set")
        void disabledByDefault() {
            runner.run(context -> {
                assertThat(context).hasNotFailed();
                assertThat(context).doesNotHaveBean(DatabaseSeeder.class);
            });
        }

        @Test
        @DisplayName("is skipped when seed.enabled=false")
        void disabledExplicitly() {
            runner.withPropertyValues("seed.enabled=false", "seed.users[0].username=admin",
                            "seed.users[0].password=password123")
                    .run(context -> assertThat(context).doesNotHaveBean(DatabaseSeeder.class));
        }

        @Test
        @DisplayName("is registered when seed.enabled=true and binds users with their tasks")
        void enabled() {
            runner.withPropertyValues("seed.enabled=true",
                            "seed.users[0].username=admin",
                            "seed.users[0].password=password123",
                            "seed.users[0].tasks[0].title=Implement Authentication",
                            "seed.users[0].tasks[0].status=InProgress",
                            "seed.users[0].tasks[1].title=Write docs")
                    .run(context -> {
                        assertThat(context).hasSingleBean(DatabaseSeeder.class);
                        SeedUser admin = context.getBean(SeedProperties.class).users().get(0);
                        assertThat(admin.username()).isEqualTo("admin");
                        assertThat(admin.tasks()).extracting(SeedTask::status)
                                .containsExactly(TaskStatus.IN_PROGRESS, TaskStatus.TODO);
                    });
        }

        @Test
        @DisplayName("fails startup when a seeded user has a blank password")
        void blankPassword() {
            runner.withPropertyValues("seed.enabled=true", "seed.users[0].username=admin",
                            "seed.users[0].password= ")
                    .run(context -> assertThat(context).hasFailed());
        }
    }

    @Nested
    @DisplayName("run")
    @ExtendWith(MockitoExtension.class)
    class Run {

        @Mock
        private UserRepository userRepository;

        @Mock
        private TaskService taskService;

        private PasswordHasher passwordHasher;

        @BeforeEach
        void setUp() {
            passwordHasher = new PasswordHasher(new PasswordProperties(4, 6));
        }

        private DatabaseSeeder seeder(SeedUser... users) {
            return new DatabaseSeeder(new SeedProperties(true, List.of(users)),
                    userRepository, passwordHasher, taskService);
        }

        private void persistUsers() {
            when(userRepository.saveAndFlush(any(User.class))).thenAnswer(invocation -> {
                User user = invocation.getArgument(0);
                user.prePersist();
                return user;
            });
        }

        @Test
        @DisplayName("stores a hash of the configured password, never the plaintext")
        void hashesPasswords() {
            when(userRepository.count()).thenReturn(0L);
            persistUsers();

            seeder(new SeedUser("admin", "password123", List.of())).run(null);

            ArgumentCaptor<User> saved = ArgumentCaptor.forClass(User.class);
            verify(userRepository).saveAndFlush(saved.capture());
            assertThat(saved.getValue().getUsername()).isEqualTo("admin");
            assertThat(saved.getValue().getPasswordHash()).isNotEqualTo("password123");
            assertThat(passwordHasher.verify("password123", saved.getValue().getPasswordHash())).isTrue();
            verifyNoInteractions(taskService);
        }

        @Test
        @DisplayName("creates tasks through TaskService with the seeded user as owner")
        void createsTasksForOwner() {
            when(userRepository.count()).thenReturn(0L);
            persistUsers();
            Task created = Task.builder().id(7L).title("Implement Authentication").status(TaskStatus.TODO).build();
            when(taskService.create(any(TaskRequest.class), any(UUID.class))).thenReturn(TaskResult.success(created));
            when(taskService.updateStatus(eq(7L), eq(TaskStatus.IN_PROGRESS), any(UUID.class)))
                    .thenReturn(TaskResult.success(created));

            seeder(new SeedUser("admin", "password123", List.of(
                    new SeedTask("Implement Authentication", "JWT login", TaskStatus.IN_PROGRESS))))
                    .run(null);

            ArgumentCaptor<User> saved = ArgumentCaptor.forClass(User.class);
            verify(userRepository).saveAndFlush(saved.capture());
            UUID ownerId = saved.getValue().getId();
            ArgumentCaptor<TaskRequest> request = ArgumentCaptor.forClass(TaskRequest.class);
            verify(taskService).create(request.capture(), eq(ownerId));
            assertThat(request.getValue().getTitle()).isEqualTo("Implement Authentication");
            verify(taskService).updateStatus(7L, TaskStatus.IN_PROGRESS, ownerId);
        }

        @Test
        @DisplayName("leaves a ToDo task in its initial status")
        void todoTaskNotUpdated() {
            when(userRepository.count()).thenReturn(0L);
            persistUsers();
            Task created = Task.builder().id(3L).title("Design Database Schema").status(TaskStatus.TODO).build();
            when(taskService.create(any(TaskRequest.class), any(UUID.class))).thenReturn(TaskResult.success(created));

            seeder(new SeedUser("testuser", "testpass", List.of(
                    new SeedTask("Design Database Schema", null, null)))).run(null);

            verify(taskService).create(any(TaskRequest.class), any(UUID.class));
            verify(taskService, never()).updateStatus(any(), any(), any());
        }

        @Test
        @DisplayName("does nothing when users already exist")
        void skipsPopulatedDatabase() {
            when(userRepository.count()).thenReturn(2L);

            seeder(new SeedUser("admin", "password123", List.of(
                    new SeedTask("Setup", null, TaskStatus.COMPLETED)))).run(null);

            verify(userRepository, never()).saveAndFlush(any());
            verifyNoInteractions(taskService);
        }

        @Test
        @DisplayName("fails when TaskService rejects a seeded task")
        void rejectedTaskFails() {
            when(userRepository.count()).thenReturn(0L);
            persistUsers();
            when(taskService.create(any(TaskRequest.class), any(UUID.class)))
                    .thenReturn(TaskResult.invalid("Title cannot exceed 200 characters"));

            DatabaseSeeder seeder = seeder(new SeedUser("admin", "password123", List.of(
                    new SeedTask("x".repeat(201), null, TaskStatus.TODO))));

            assertThatThrownBy(() -> seeder.run(null))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("Title cannot exceed 200 characters");
        }
    }
}
