package com.tasktracker.repository;

import com.tasktracker.entity.Task;
import com.tasktracker.entity.TaskStatus;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * TaskRepository - Owner-scoped data access for tasks.
 * 
 * Extends the bare {@link org.springframework.data.repository.Repository} marker instead of
 * JpaRepository so that findById, deleteById and findAll do not exist. Every query below
 * carries the owner in its predicate:
 * <pre>
 * ... WHERE owner_id = :ownerId [AND id = :id] [AND status = :status]
 * </pre>
 * A task belonging to someone else is therefore indistinguishable from a missing one.
 * 
 * @see com.tasktracker.service.TaskService
 */
@org.springframework.stereotype.Repository
public interface TaskRepository extends org.springframework.data.repository.Repository<Task, Long> {

    /**
     * Insert a new task or flush changes to one loaded through an owner-scoped finder.
     */
    Task save(Task task);

    /**
     * All tasks of an owner, newest first.
     */
    List<Task> findAllByOwnerIdOrderByCreatedAtDescIdDesc(UUID ownerId);

    /**
     * Tasks of an owner in one status, newest first.
     */
    List<Task> findAllByOwnerIdAndStatusOrderByCreatedAtDescIdDesc(UUID ownerId, TaskStatus status);

    /**
     * @return the task if it exists AND belongs to the owner
     */
    Optional<Task> findByIdAndOwnerId(Long id, UUID ownerId);

    /**
     * Single-statement delete on (id, owner).
     * 
     * @return rows removed: 1 if the owner's task was deleted, 0 if it is missing or foreign
     */
    @Modifying
    @Query("delete from Task t where t.id = :id and t.ownerId = :ownerId")
    int deleteByIdAndOwnerId(@Param("id") Long id, @Param("ownerId") UUID ownerId);
}
