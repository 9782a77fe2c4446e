package com.taskforge.repository;

import com.taskforge.entity.Task;
import com.taskforge.entity.TaskStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Repository interface for managing {@link Task} entities.
 */
public interface TaskRepository extends JpaRepository<Task, Long> {

    /**
     * Finds tasks in the given status, most recently created first.
     *
     * @param status The task status to match.
     * @param pageable Page bounding how many tasks are returned.
     * @return The matching tasks, newest first.
     */
    List<Task> findByStatusOrderByCreatedAtDesc(TaskStatus status, Pageable pageable);

    /**
     * Moves a task from {@code expected} to {@code target} in a single conditional update.
     * The version column is bumped so concurrent aggregations notice the change.
     *
     * @return 1 when this caller performed the transition, 0 when the task was not in {@code expected}.
     */
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update Task t set t.status = :target, t.updatedAt = :now, t.version = t.version + 1 "
            + "where t.id = :id and t.status = :expected")
    int compareAndSetStatus(@Param("id") Long id,
                            @Param("expected") TaskStatus expected,
                            @Param("target") TaskStatus target,
                            @Param("now") OffsetDateTime now);
}
