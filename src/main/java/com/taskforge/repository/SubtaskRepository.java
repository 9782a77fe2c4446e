package com.taskforge.repository;

import com.taskforge.entity.Subtask;
import com.taskforge.entity.SubtaskRole;
import com.taskforge.entity.SubtaskStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for managing {@link Subtask} entities.
 * All ordering follows the per-task sequence key ({@code messageId}), creation time breaking ties.
 */
public interface SubtaskRepository extends JpaRepository<Subtask, Long> {

    /**
     * Finds the earliest subtask of a task with the given role and status.
     *
     * @param taskId The parent task id.
     * @param role The subtask role.
     * @param status The status to match.
     * @return The subtask with the smallest sequence key, or empty.
     */
    Optional<Subtask> findFirstByTaskIdAndRoleAndStatusOrderByMessageIdAscCreatedAtAsc(Long taskId,
                                                                                      SubtaskRole role,
                                                                                      SubtaskStatus status);

    long countByTaskIdAndStatus(Long taskId, SubtaskStatus status);

    List<Subtask> findByTaskIdOrderByMessageIdAscCreatedAtAsc(Long taskId);

    List<Subtask> findByTaskIdAndRoleOrderByMessageIdAscCreatedAtAsc(Long taskId, SubtaskRole role);

    /**
     * Moves a subtask from {@code expected} to {@code target} in a single conditional update.
     *
     * @return 1 when this caller won the transition, 0 otherwise.
     */
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update Subtask s set s.status = :target, s.updatedAt = :now "
            + "where s.id = :id and s.status = :expected")
    int compareAndSetStatus(@Param("id") Long id,
                            @Param("expected") SubtaskStatus expected,
                            @Param("target") SubtaskStatus target,
                            @Param("now") OffsetDateTime now);
}
