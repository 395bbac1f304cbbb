package com.tasktracker.service;

import com.tasktracker.dto.TaskRequest;
import com.tasktracker.entity.Task;
import com.tasktracker.entity.TaskStatus;
import com.tasktracker.repository.TaskRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("TaskService")
class TaskServiceTest {

    private static final UUID ALICE = UUID.fromString("00000000-0000-0000-0000-00000000000a");
    private static final UUID BOB = UUID.fromString("00000000-0000-0000-0000-00000000000b");

    @Mock
    private TaskRepository taskRepository;

    @InjectMocks
    private TaskService taskService;

    private static Task task(long id, UUID owner, String title) {
        return Task.builder().id(id).ownerId(owner).title(title).status(TaskStatus.TODO).build();
    }

    @Nested
    @DisplayName("create")
    class Create {

        @Test
        @DisplayName("stamps the acting user as owner and starts in TODO")
        void stampsOwner() {
            when(taskRepository.save(any(Task.class))).thenAnswer(invocation -> invocation.getArgument(0));

            TaskResult<Task> result = taskService.create(new TaskRequest("  Buy milk  ", "  2 litres "), ALICE);

            assertThat(result.isSuccess()).isTrue();
            ArgumentCaptor<Task> saved = ArgumentCaptor.forClass(Task.class);
            verify(taskRepository).save(saved.capture());
            assertThat(saved.getValue().getOwnerId()).isEqualTo(ALICE);
            assertThat(saved.getValue().getStatus()).isEqualTo(TaskStatus.TODO);
            assertThat(saved.getValue().getTitle()).isEqualTo("Buy milk");
            assertThat(saved.getValue().getDescription()).isEqualTo("2 litres");
        }

        @Test
        @DisplayName("blank description is stored as null")
        void blankDescription() {
            when(taskRepository.save(any(Task.class))).thenAnswer(invocation -> invocation.getArgument(0));

            TaskResult<Task> result = taskService.create(new TaskRequest("Title", "   "), ALICE);

            assertThat(result.getValue().getDescription()).isNull();
        }

        @Test
        @DisplayName("missing title is a validation failure")
        void missingTitle() {
            TaskResult<Task> result = taskService.create(new TaskRequest(" ", null), ALICE);

            assertThat(result.getError()).isEqualTo(TaskError.VALIDATION);
            assertThat(result.getMessage()).isEqualTo("Task title is required");
            verifyNoInteractions(taskRepository);
        }

        @Test
        @DisplayName("over-long title and description are validation failures")
        void overLongFields() {
            assertThat(taskService.create(new TaskRequest("t".repeat(201), null), ALICE).getMessage())
                    .isEqualTo("Task title cannot exceed 200 characters");
            assertThat(taskService.create(new TaskRequest("ok", "d".repeat(1001)), ALICE).getMessage())
                    .isEqualTo("Task description cannot exceed 1000 characters");
            verifyNoInteractions(taskRepository);
        }

        @Test
        @DisplayName("null owner is a programming error")
        void nullOwner() {
            assertThatThrownBy(() -> taskService.create(new TaskRequest("Title", null), null))
                    .isInstanceOf(NullPointerException.class);
        }
    }

    @Nested
    @DisplayName("reads")
    class Reads {

        @Test
        @DisplayName("list is scoped to the owner")
        void listByOwner() {
            List<Task> mine = List.of(task(2, ALICE, "second"), task(1, ALICE, "first"));
            when(taskRepository.findAllByOwnerIdOrderByCreatedAtDescIdDesc(ALICE)).thenReturn(mine);

            assertThat(taskService.listByOwner(ALICE).getValue()).isEqualTo(mine);
        }

        @Test
        @DisplayName("status filter is scoped to the owner")
        void listByStatus() {
            when(taskRepository.findAllByOwnerIdAndStatusOrderByCreatedAtDescIdDesc(ALICE, TaskStatus.COMPLETED))
                    .thenReturn(List.of());

            assertThat(taskService.listByStatus(TaskStatus.COMPLETED, ALICE).getValue()).isEmpty();
        }

        @Test
        @DisplayName("null status is a validation failure")
        void nullStatus() {
            assertThat(taskService.listByStatus(null, ALICE).getError()).isEqualTo(TaskError.VALIDATION);
        }

        @Test
        @DisplayName("foreign task reads as not found, identical to a missing one")
        void foreignTaskNotFound() {
            when(taskRepository.findByIdAndOwnerId(1L, BOB)).thenReturn(Optional.empty());
            when(taskRepository.findByIdAndOwnerId(999L, BOB)).thenReturn(Optional.empty());

            TaskResult<Task> foreign = taskService.getById(1L, BOB);
            TaskResult<Task> missing = taskService.getById(999L, BOB);

            assertThat(foreign.getError()).isEqualTo(TaskError.NOT_FOUND);
            assertThat(foreign).isEqualTo(missing);
        }

        @Test
        @DisplayName("non-positive id is a validation failure")
        void invalidId() {
            assertThat(taskService.getById(0L, ALICE).getMessage()).isEqualTo("Invalid task ID");
            assertThat(taskService.getById(null, ALICE).getMessage()).isEqualTo("Invalid task ID");
            verifyNoInteractions(taskRepository);
        }
    }

    @Nested
    @DisplayName("writes")
    class Writes {

        @Test
        @DisplayName("update changes title and description of the owner's task")
        void update() {
            Task existing = task(1, ALICE, "old");
            when(taskRepository.findByIdAndOwnerId(1L, ALICE)).thenReturn(Optional.of(existing));
            when(taskRepository.save(existing)).thenReturn(existing);

            TaskResult<Task> result = taskService.update(1L, new TaskRequest("new", "desc"), ALICE);

            assertThat(result.getValue().getTitle()).isEqualTo("new");
            assertThat(result.getValue().getDescription()).isEqualTo("desc");
            assertThat(result.getValue().getOwnerId()).isEqualTo(ALICE);
        }

        @Test
        @DisplayName("update of a foreign task is not found and saves nothing")
        void updateForeign() {
            when(taskRepository.findByIdAndOwnerId(1L, BOB)).thenReturn(Optional.empty());

            TaskResult<Task> result = taskService.update(1L, new TaskRequest("hijack", null), BOB);

            assertThat(result.getError()).isEqualTo(TaskError.NOT_FOUND);
            verify(taskRepository, never()).save(any());
        }

        @Test
        @DisplayName("status change of the owner's task")
        void updateStatus() {
            Task existing = task(1, ALICE, "t");
            when(taskRepository.findByIdAndOwnerId(1L, ALICE)).thenReturn(Optional.of(existing));
            when(taskRepository.save(existing)).thenReturn(existing);

            TaskResult<Task> result = taskService.updateStatus(1L, TaskStatus.IN_PROGRESS, ALICE);

            assertThat(result.getValue().getStatus()).isEqualTo(TaskStatus.IN_PROGRESS);
        }

        @Test
        @DisplayName("status change of a foreign task is not found")
        void updateStatusForeign() {
            when(taskRepository.findByIdAndOwnerId(1L, BOB)).thenReturn(Optional.empty());

            assertThat(taskService.updateStatus(1L, TaskStatus.COMPLETED, BOB).getError())
                    .isEqualTo(TaskError.NOT_FOUND);
            verify(taskRepository, never()).save(any());
        }

        @Test
        @DisplayName("delete removes the owner's task")
        void delete() {
            when(taskRepository.deleteByIdAndOwnerId(1L, ALICE)).thenReturn(1);

            TaskResult<Long> result = taskService.delete(1L, ALICE);

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getValue()).isEqualTo(1L);
        }

        @Test
        @DisplayName("delete of a foreign task affects nothing and is not found")
        void deleteForeign() {
            when(taskRepository.deleteByIdAndOwnerId(1L, BOB)).thenReturn(0);

            assertThat(taskService.delete(1L, BOB).getError()).isEqualTo(TaskError.NOT_FOUND);
        }
    }
}
