package com.tasktracker.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Task - JPA Entity for a personal task, always owned by exactly one user.
 * 
 * Table Schema (from V1__initial_schema.sql):
 * - id: BIGINT identity primary key
 * - title / description: user content
 * - status: TODO, IN_PROGRESS or COMPLETED
 * - owner_id: users.id of the creator (ON DELETE CASCADE)
 * - created_at / updated_at: maintained by Hibernate
 * 
 * Ownership:
 * ownerId is stamped at creation from the authenticated identity and has no setter;
 * the column is not updatable. All reads and writes go through the owner-scoped
 * methods of TaskRepository.
 * 
 * @see com.tasktracker.repository.TaskRepository
 * @see com.tasktracker.service.TaskService
 */
@Entity
@Table(name = "tasks")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Task {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "title", nullable = false)
    private String title;

    @Column(name = "description", length = 1000)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 50)
    @Builder.Default
    private TaskStatus status = TaskStatus.TODO;

    @Setter(AccessLevel.NONE)
    @Column(name = "owner_id", columnDefinition = "UUID", nullable = false, updatable = false)
    private UUID ownerId;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
