package com.taskforge.coordination.api;

import com.taskforge.coordination.model.DispatchBatch;
import com.taskforge.entity.SubtaskStatus;
import org.springframework.lang.Nullable;

import java.util.List;

/**
 * Service interface for claiming executable subtasks on behalf of a worker.
 * Claims are atomic per subtask, so concurrent workers never receive the same subtask.
 */
public interface DispatchService {

    /**
     * Claims the next eligible ASSISTANT subtasks and assembles their execution contexts.
     * Never blocks waiting for work; an empty batch means nothing was claimable.
     *
     * @param statusFilter Status the selected subtasks (and, in pool mode, their tasks) must have.
     * @param limit Maximum number of tasks to take in pool mode; ignored when {@code taskIds} is given.
     * @param taskIds Optional explicit task ids. Each one yields at most one subtask.
     * @return The assembled contexts plus the claimed or selected items that were skipped, with reasons.
     */
    DispatchBatch dispatch(SubtaskStatus statusFilter, @Nullable Integer limit, @Nullable List<Long> taskIds);
}
