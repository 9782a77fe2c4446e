package com.taskforge.stream;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskforge.config.TaskForgeProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-task rooms of connected observers. Every published event is buffered (bounded) so an observer
 * that reconnects can replay what it missed. Unwatched rooms are pruned from the publishing side as well
 * as by the scheduled sweep, so tasks nobody watches do not pile up.
 */
@Component
public class TaskStreamHub {
    private static final Logger log = LoggerFactory.getLogger(TaskStreamHub.class);
    private static final Duration FINISHED_ROOM_TTL = Duration.ofMinutes(30);
    private static final Duration PRUNE_INTERVAL = Duration.ofMinutes(1);
    static final String TASK_ID_ATTRIBUTE = "taskId";

    private final ObjectMapper objectMapper;
    private final TaskForgeProperties properties;
    private final Clock clock;
    private final Map<Long, TaskStreamRoom> rooms = new ConcurrentHashMap<>();
    private final AtomicLong lastPrune = new AtomicLong();

    public TaskStreamHub(ObjectMapper objectMapper, TaskForgeProperties properties, Clock clock) {
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
    }

    public void registerSession(Long taskId, WebSocketSession session, long sinceId) {
        pruneRooms();
        TaskStreamRoom room = rooms.computeIfAbsent(taskId, id -> new TaskStreamRoom(id, clock.instant()));
        room.attach(session);
        session.getAttributes().put(TASK_ID_ATTRIBUTE, taskId);
        for (TaskStreamEvent event : room.eventsAfter(sinceId)) {
            send(session, event);
        }
    }

    public void removeSession(WebSocketSession session) {
        Object taskIdObj = session.getAttributes().get(TASK_ID_ATTRIBUTE);
        if (!(taskIdObj instanceof Long taskId)) {
            return;
        }
        TaskStreamRoom room = rooms.get(taskId);
        if (room != null) {
            room.detach(session.getId());
        }
    }

    public TaskStreamEvent publish(Long taskId, String type, Object data) {
        return append(taskId, type, data, false);
    }

    /**
     * Publishes the last event of a stream; the room becomes eligible for pruning once nobody watches it.
     */
    public TaskStreamEvent publishFinal(Long taskId, String type, Object data) {
        return append(taskId, type, data, true);
    }

    public List<TaskStreamEvent> replay(Long taskId, long sinceId) {
        TaskStreamRoom room = rooms.get(taskId);
        return room != null ? room.eventsAfter(sinceId) : List.of();
    }

    public int observerCount(Long taskId) {
        TaskStreamRoom room = rooms.get(taskId);
        return room != null ? room.observers().size() : 0;
    }

    public int roomCount() {
        return rooms.size();
    }

    /**
     * Drops unwatched rooms that finished more than 30 minutes ago, or saw no event for the stale-session timeout.
     *
     * @return the number of rooms dropped
     */
    public int pruneRooms() {
        Instant now = clock.instant();
        lastPrune.set(now.toEpochMilli());
        Duration idleTtl = properties.getStreaming().getStaleSessionTimeout();
        AtomicInteger removed = new AtomicInteger();
        for (Long taskId : rooms.keySet()) {
            rooms.computeIfPresent(taskId, (id, room) -> {
                if (room.isReclaimable(now, FINISHED_ROOM_TTL, idleTtl)) {
                    removed.incrementAndGet();
                    return null;
                }
                return room;
            });
        }
        if (removed.get() > 0) {
            log.debug("Pruned {} task stream rooms, {} left.", removed.get(), rooms.size());
        }
        return removed.get();
    }

    private TaskStreamEvent append(Long taskId, String type, Object data, boolean last) {
        pruneIfDue();
        TaskStreamEvent[] appended = new TaskStreamEvent[1];
        TaskStreamRoom room = rooms.compute(taskId, (id, existing) -> {
            TaskStreamRoom target = existing != null ? existing : new TaskStreamRoom(id, clock.instant());
            appended[0] = target.append(type, data, last, properties.getStreaming().getReplayBufferSize(),
                    clock.instant());
            return target;
        });
        room.observers().forEach(session -> send(session, appended[0]));
        return appended[0];
    }

    private void pruneIfDue() {
        long now = clock.millis();
        long previous = lastPrune.get();
        if (now - previous >= PRUNE_INTERVAL.toMillis() && lastPrune.compareAndSet(previous, now)) {
            pruneRooms();
        }
    }

    private void send(WebSocketSession session, TaskStreamEvent event) {
        if (!session.isOpen()) {
            return;
        }
        try {
            String payload = objectMapper.writeValueAsString(event);
            synchronized (session) {
                session.sendMessage(new TextMessage(payload));
            }
        } catch (IOException ex) {
            log.debug("Failed to send task event: {}", ex.getMessage());
        }
    }
}
