package com.taskforge.coordination.service;

import com.taskforge.config.TaskForgeProperties;
import com.taskforge.coordination.model.ContextAssembly;
import com.taskforge.coordination.model.DispatchBatch;
import com.taskforge.coordination.model.ExecutionContext;
import com.taskforge.entity.Subtask;
import com.taskforge.entity.SubtaskRole;
import com.taskforge.entity.SubtaskStatus;
import com.taskforge.entity.Task;
import com.taskforge.entity.TaskStatus;
import com.taskforge.repository.SubtaskRepository;
import com.taskforge.repository.TaskRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.domain.Pageable;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class DispatchServiceImplTest {

    private TaskRepository taskRepository;
    private SubtaskRepository subtaskRepository;
    private SubtaskClaimService claimService;
    private ExecutionContextAssembler assembler;
    private DispatchServiceImpl dispatchService;

    @BeforeEach
    void setUp() {
        taskRepository = mock(TaskRepository.class);
        subtaskRepository = mock(SubtaskRepository.class);
        claimService = mock(SubtaskClaimService.class);
        assembler = mock(ExecutionContextAssembler.class);
        dispatchService = new DispatchServiceImpl(taskRepository, subtaskRepository, claimService, assembler,
                new TaskForgeProperties());
        when(claimService.claim(any())).thenReturn(true);
        when(assembler.assemble(any())).thenAnswer(invocation -> {
            Subtask subtask = invocation.getArgument(0);
            return ContextAssembly.assembled(context(subtask));
        });
    }

    @Test
    void testPoolModeTakesNewestTasksUpToLimit() {
        Task newer = task(2L, TaskStatus.PENDING);
        Task older = task(1L, TaskStatus.PENDING);
        when(taskRepository.findByStatusOrderByCreatedAtDesc(eq(TaskStatus.PENDING), any()))
                .thenReturn(List.of(newer, older));
        when(subtaskRepository.findFirstByTaskIdAndRoleAndStatusOrderByMessageIdAscCreatedAtAsc(2L,
                SubtaskRole.ASSISTANT, SubtaskStatus.PENDING)).thenReturn(Optional.of(subtask(20L, 2L)));
        when(subtaskRepository.findFirstByTaskIdAndRoleAndStatusOrderByMessageIdAscCreatedAtAsc(1L,
                SubtaskRole.ASSISTANT, SubtaskStatus.PENDING)).thenReturn(Optional.empty());

        DispatchBatch batch = dispatchService.dispatch(SubtaskStatus.PENDING, 5, null);

        assertEquals(List.of(20L), batch.tasks().stream().map(ExecutionContext::subtaskId).toList());
        ArgumentCaptor<Pageable> page =
                ArgumentCaptor.forClass(Pageable.class);
        verify(taskRepository).findByStatusOrderByCreatedAtDesc(eq(TaskStatus.PENDING), page.capture());
        assertEquals(5, page.getValue().getPageSize());
    }

    @Test
    void testPoolModeClampsLimit() {
        when(taskRepository.findByStatusOrderByCreatedAtDesc(any(), any())).thenReturn(List.of());

        dispatchService.dispatch(null, 1000, null);

        ArgumentCaptor<Pageable> page =
                ArgumentCaptor.forClass(Pageable.class);
        verify(taskRepository).findByStatusOrderByCreatedAtDesc(eq(TaskStatus.PENDING), page.capture());
        assertEquals(50, page.getValue().getPageSize());
    }

    @Test
    void testTargetedModeSkipsIneligibleTasks() {
        when(taskRepository.findById(1L)).thenReturn(Optional.of(task(1L, TaskStatus.COMPLETED)));
        when(taskRepository.findById(2L)).thenReturn(Optional.of(task(2L, TaskStatus.RUNNING)));
        when(taskRepository.findById(3L)).thenReturn(Optional.empty());
        when(taskRepository.findById(4L)).thenReturn(Optional.of(task(4L, TaskStatus.PENDING)));
        when(subtaskRepository.countByTaskIdAndStatus(2L, SubtaskStatus.RUNNING)).thenReturn(1L);
        when(subtaskRepository.countByTaskIdAndStatus(4L, SubtaskStatus.RUNNING)).thenReturn(0L);
        when(subtaskRepository.findFirstByTaskIdAndRoleAndStatusOrderByMessageIdAscCreatedAtAsc(4L,
                SubtaskRole.ASSISTANT, SubtaskStatus.PENDING)).thenReturn(Optional.of(subtask(40L, 4L)));

        DispatchBatch batch = dispatchService.dispatch(SubtaskStatus.PENDING, 1, List.of(1L, 2L, 3L, 4L));

        assertEquals(1, batch.tasks().size());
        assertEquals(Long.valueOf(40L), batch.tasks().get(0).subtaskId());
        assertEquals(3, batch.skipped().size());
        verify(taskRepository, never()).findByStatusOrderByCreatedAtDesc(any(), any());
    }

    @Test
    void testTargetedModeIgnoresLimit() {
        for (long id = 1; id <= 3; id++) {
            when(taskRepository.findById(id)).thenReturn(Optional.of(task(id, TaskStatus.PENDING)));
            when(subtaskRepository.findFirstByTaskIdAndRoleAndStatusOrderByMessageIdAscCreatedAtAsc(id,
                    SubtaskRole.ASSISTANT, SubtaskStatus.PENDING)).thenReturn(Optional.of(subtask(id * 10, id)));
        }

        DispatchBatch batch = dispatchService.dispatch(SubtaskStatus.PENDING, 1, List.of(1L, 2L, 3L));

        assertEquals(3, batch.tasks().size());
    }

    @Test
    void testLostClaimProducesNoContext() {
        when(taskRepository.findById(1L)).thenReturn(Optional.of(task(1L, TaskStatus.PENDING)));
        when(subtaskRepository.findFirstByTaskIdAndRoleAndStatusOrderByMessageIdAscCreatedAtAsc(1L,
                SubtaskRole.ASSISTANT, SubtaskStatus.PENDING)).thenReturn(Optional.of(subtask(10L, 1L)));
        when(claimService.claim(any())).thenReturn(false);

        DispatchBatch batch = dispatchService.dispatch(SubtaskStatus.PENDING, 1, List.of(1L));

        assertTrue(batch.tasks().isEmpty());
        assertTrue(batch.skipped().isEmpty());
        verifyNoInteractions(assembler);
    }

    @Test
    void testOneBrokenSubtaskDoesNotBlockTheBatch() {
        when(taskRepository.findByStatusOrderByCreatedAtDesc(eq(TaskStatus.PENDING), any()))
                .thenReturn(List.of(task(1L, TaskStatus.PENDING), task(2L, TaskStatus.PENDING)));
        when(subtaskRepository.findFirstByTaskIdAndRoleAndStatusOrderByMessageIdAscCreatedAtAsc(1L,
                SubtaskRole.ASSISTANT, SubtaskStatus.PENDING)).thenReturn(Optional.of(subtask(10L, 1L)));
        when(subtaskRepository.findFirstByTaskIdAndRoleAndStatusOrderByMessageIdAscCreatedAtAsc(2L,
                SubtaskRole.ASSISTANT, SubtaskStatus.PENDING)).thenReturn(Optional.of(subtask(20L, 2L)));
        doThrow(new IllegalStateException("bad bot config"))
                .when(assembler).assemble(argThat(subtask -> subtask != null && subtask.getId() == 10L));

        DispatchBatch batch = dispatchService.dispatch(SubtaskStatus.PENDING, 2, null);

        assertEquals(1, batch.tasks().size());
        assertEquals(Long.valueOf(20L), batch.tasks().get(0).subtaskId());
        assertEquals(1, batch.skipped().size());
        assertEquals(Long.valueOf(10L), batch.skipped().get(0).subtaskId());
    }

    private static Task task(Long id, TaskStatus status) {
        return Task.builder().id(id).userId(1L).status(status).build();
    }

    private static Subtask subtask(Long id, Long taskId) {
        return Subtask.builder()
                .id(id)
                .taskId(taskId)
                .userId(1L)
                .role(SubtaskRole.ASSISTANT)
                .messageId(id)
                .status(SubtaskStatus.PENDING)
                .build();
    }

    private static ExecutionContext context(Subtask subtask) {
        return new ExecutionContext(subtask.getId(), null, subtask.getTaskId(), null, null, null, null, null,
                List.of(), null, null, null, null, null, null, null, "", subtask.getStatus(), 0, null, null,
                List.of());
    }
}
