package com.taskforge.stream;

import org.springframework.web.socket.WebSocketSession;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Observers of one task plus the newest events kept for replay.
 * A room is finished once its last event was a done/error notification; any later event reopens it.
 */
class TaskStreamRoom {

    private final Long taskId;
    private final Map<String, WebSocketSession> observers = new ConcurrentHashMap<>();
    private final Deque<TaskStreamEvent> recent = new ArrayDeque<>();
    private long lastEventId;
    private volatile Instant lastActivity;
    private volatile boolean finished;

    TaskStreamRoom(Long taskId, Instant openedAt) {
        this.taskId = taskId;
        this.lastActivity = openedAt;
    }

    synchronized TaskStreamEvent append(String type, Object data, boolean last, int capacity, Instant now) {
        TaskStreamEvent event = new TaskStreamEvent(++lastEventId, taskId, type, now, data);
        recent.addLast(event);
        while (recent.size() > capacity) {
            recent.pollFirst();
        }
        finished = last;
        lastActivity = now;
        return event;
    }

    synchronized List<TaskStreamEvent> eventsAfter(long cursor) {
        List<TaskStreamEvent> missed = new ArrayList<>();
        for (TaskStreamEvent event : recent) {
            if (event.id() > cursor) {
                missed.add(event);
            }
        }
        return missed;
    }

    void attach(WebSocketSession session) {
        observers.put(session.getId(), session);
    }

    void detach(String sessionId) {
        observers.remove(sessionId);
    }

    Collection<WebSocketSession> observers() {
        return observers.values();
    }

    /**
     * A watched room is always kept. An unwatched one is dropped {@code finishedTtl} after its final event,
     * or {@code idleTtl} after its last event when the producer never finished.
     */
    boolean isReclaimable(Instant now, Duration finishedTtl, Duration idleTtl) {
        if (!observers.isEmpty()) {
            return false;
        }
        return lastActivity.plus(finished ? finishedTtl : idleTtl).isBefore(now);
    }
}
