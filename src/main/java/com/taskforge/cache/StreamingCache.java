package com.taskforge.cache;

import java.util.Optional;

/**
 * Fast, TTL-bounded storage for in-flight streaming buffers, keyed by subtask id.
 * Write operations propagate store failures so callers can decide whether a flush happened.
 */
public interface StreamingCache {

    /**
     * Writes an empty buffer and an initial state record for a subtask that just started streaming.
     */
    void initialize(Long taskId, Long subtaskId, long startedAt);

    /**
     * Replaces the cached buffers and state record of a subtask with the given copy.
     */
    void write(CachedStream stream);

    /**
     * Reads back whatever is cached for a subtask; empty when nothing is cached or the entries expired.
     */
    Optional<CachedStream> read(Long subtaskId);

    /**
     * Removes every streaming key of a subtask.
     */
    void purge(Long subtaskId);

    /**
     * Raises the advisory cancel flag of a subtask. Returns {@code false} if the flag could not be written.
     */
    boolean requestCancel(Long subtaskId);

    boolean isCancelRequested(Long subtaskId);
}
