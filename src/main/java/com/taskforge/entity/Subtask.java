package com.taskforge.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * One execution step of a {@link Task}. USER rows carry the human prompt, ASSISTANT rows carry agent output.
 * {@code messageId} is strictly increasing inside a task and orders both prompt aggregation and dispatch.
 */
@Entity
@Table(name = "subtask", indexes = {
        @Index(name = "idx_subtask_task_message", columnList = "task_id, message_id"),
        @Index(name = "idx_subtask_task_status", columnList = "task_id, status")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Subtask {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "task_id", nullable = false)
    private Long taskId;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", length = 20, nullable = false)
    private SubtaskRole role;

    @Column(name = "message_id", nullable = false)
    private long messageId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", length = 20, nullable = false)
    @Builder.Default
    private SubtaskStatus status = SubtaskStatus.PENDING;

    @Column(name = "progress", nullable = false)
    private int progress;

    @Column(name = "title")
    private String title;

    @Column(name = "prompt", columnDefinition = "TEXT")
    private String prompt;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "result")
    private Map<String, Object> result;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "bot_ids")
    @Builder.Default
    private List<Long> botIds = new ArrayList<>();

    @Column(name = "executor_name")
    private String executorName;

    @Column(name = "executor_namespace")
    private String executorNamespace;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    @Column(name = "completed_at")
    private OffsetDateTime completedAt;
}
