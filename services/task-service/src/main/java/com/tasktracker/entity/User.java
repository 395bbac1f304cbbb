package com.tasktracker.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * User - JPA Entity holding an identity's credential record.
 * 
 * This entity maps to the 'users' table and is the owner referenced by every task.
 * 
 * Table Schema (from V1__initial_schema.sql):
 * - id: UUID primary key
 * - username: Unique login name (case-sensitive, never changed once assigned)
 * - password_hash: BCrypt hash of the password (never the plaintext)
 * - created_at: Account creation timestamp (immutable)
 * 
 * Security Rules:
 * - passwordHash is excluded from toString() so it cannot reach a log line
 * - The entity is never serialized to clients; controllers map to DTOs
 * - Hashes are only ever compared through PasswordHasher.verify, never with equals
 * 
 * Lifecycle:
 * - Created once by AuthService.register
 * - Read on every login
 * - Removing a user cascades to their tasks (foreign key ON DELETE CASCADE)
 * 
 * @see com.tasktracker.repository.UserRepository for database operations
 * @see com.tasktracker.service.AuthService for user creation logic
 */
@Entity
@Table(name = "users")
@Data
@NoArgsConstructor  // required by JPA
@AllArgsConstructor
@Builder
public class User {

    /** Maximum username length, mirrors the column definition. */
    public static final int MAX_USERNAME_LENGTH = 100;

    /**
     * Unique identifier for the user, also the subject claim of their tokens.
     * 
     * UUIDs keep ids non-sequential so they cannot be enumerated.
     */
    @Id
    @Column(name = "id", columnDefinition = "UUID")
    private UUID id;

    /**
     * Login name.
     * 
     * Constraints:
     * - UNIQUE: enforced by uk_users_username
     * - NOT NULL, at most 100 characters
     * - updatable = false: immutable once assigned
     */
    @Column(name = "username", unique = true, nullable = false, updatable = false, length = MAX_USERNAME_LENGTH)
    private String username;

    /** Self-describing BCrypt hash (algorithm, cost and salt embedded). */
    @ToString.Exclude
    @Column(name = "password_hash", nullable = false)
    private String passwordHash;

    /**
     * Timestamp when the account was created.
     * 
     * @CreationTimestamp: Hibernate sets it on INSERT
     */
    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    /**
     * Assigns a UUID before INSERT when the builder did not supply one.
     */
    @PrePersist
    public void prePersist() {
        if (id == null) {
            id = UUID.randomUUID();
        }
    }
}
