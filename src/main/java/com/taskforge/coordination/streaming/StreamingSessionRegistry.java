package com.taskforge.coordination.streaming;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local registry of streaming sessions keyed by subtask id.
 * The map only guards insert, lookup and removal; each session serializes its own mutations.
 */
@Component
@Slf4j
public class StreamingSessionRegistry {

    private final Map<Long, StreamingSession> sessions = new ConcurrentHashMap<>();

    /**
     * Returns the session of a subtask, creating it on first use.
     */
    public Registration open(Long taskId, Long subtaskId, long now) {
        boolean[] created = new boolean[1];
        StreamingSession session = sessions.computeIfAbsent(subtaskId, id -> {
            created[0] = true;
            return new StreamingSession(taskId, id, now);
        });
        if (created[0]) {
            log.debug("Opened streaming session for subtask {} (task {}).", subtaskId, taskId);
        }
        return new Registration(session, created[0]);
    }

    public Optional<StreamingSession> find(Long subtaskId) {
        return Optional.ofNullable(sessions.get(subtaskId));
    }

    public void remove(Long subtaskId) {
        if (sessions.remove(subtaskId) != null) {
            log.debug("Closed streaming session for subtask {}.", subtaskId);
        }
    }

    public int size() {
        return sessions.size();
    }

    /**
     * Drops every session whose last flush (or creation, if it never flushed) is older than {@code timeout}.
     *
     * @return the subtask ids that were dropped
     */
    public List<Long> sweep(long now, Duration timeout) {
        long cutoff = now - timeout.toMillis();
        List<Long> removed = new ArrayList<>();
        sessions.forEach((subtaskId, session) -> {
            if (session.lastTouched() < cutoff && sessions.remove(subtaskId, session)) {
                removed.add(subtaskId);
            }
        });
        return removed;
    }

    public record Registration(StreamingSession session, boolean created) {
    }
}
