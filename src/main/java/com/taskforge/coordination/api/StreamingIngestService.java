package com.taskforge.coordination.api;

import com.taskforge.coordination.model.CancelState;
import com.taskforge.coordination.model.StreamSnapshot;
import com.taskforge.coordination.model.StreamingAck;
import org.springframework.lang.Nullable;

import java.util.Map;

/**
 * Service interface for the incremental events a worker sends while a subtask runs.
 */
public interface StreamingIngestService {

    /**
     * Applies one event to the subtask's streaming session, publishes it to the task's observers and
     * persists the session on the cache and durable cadences. Terminal events persist synchronously,
     * finalize the subtask and close the session.
     *
     * @param taskId The task that owns the subtask.
     * @param subtaskId The streaming subtask.
     * @param eventType Wire name of the event type.
     * @param payload Event payload; its expected shape depends on the type.
     * @return An acknowledgement; malformed events and processing failures are reported, not thrown.
     */
    StreamingAck process(Long taskId, Long subtaskId, String eventType, @Nullable Map<String, Object> payload);

    /**
     * Current output of a subtask, read from the live session, the cache, or the stored result, in that order.
     *
     * @throws org.springframework.web.server.ResponseStatusException with NOT_FOUND when the subtask does not exist.
     */
    StreamSnapshot snapshot(Long subtaskId);

    /**
     * Raises the advisory cancel flag of a subtask and notifies the task's observers.
     * The streaming session itself is left alone; the producer is expected to stop and send a terminal event.
     */
    CancelState requestCancel(Long subtaskId);

    CancelState cancelState(Long subtaskId);

    /**
     * Drops sessions that have not flushed within the stale-session timeout.
     *
     * @return The number of sessions dropped.
     */
    int reclaimStaleSessions();
}
