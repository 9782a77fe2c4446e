package com.taskforge.coordination.api;

import com.taskforge.coordination.model.SubtaskUpdate;
import com.taskforge.coordination.model.SubtaskUpdateResult;

/**
 * Service interface for applying worker-reported changes to a subtask and re-deriving its task's state.
 */
public interface SubtaskUpdateService {

    /**
     * Merges the non-null fields of the update into the subtask, then recomputes the parent task's
     * status and progress. Re-applying the same terminal update leaves {@code completed_at} unchanged.
     *
     * @param update The partial update.
     * @return The subtask and task state after the update.
     * @throws org.springframework.web.server.ResponseStatusException with NOT_FOUND when the subtask does not exist.
     */
    SubtaskUpdateResult update(SubtaskUpdate update);
}
