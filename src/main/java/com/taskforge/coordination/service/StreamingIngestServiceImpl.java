package com.taskforge.coordination.service;

import com.taskforge.cache.CachedStream;
import com.taskforge.cache.StreamingCache;
import com.taskforge.config.TaskForgeProperties;
import com.taskforge.coordination.api.StreamingIngestService;
import com.taskforge.coordination.api.SubtaskUpdateService;
import com.taskforge.coordination.model.CancelState;
import com.taskforge.coordination.model.StreamSnapshot;
import com.taskforge.coordination.model.StreamingAck;
import com.taskforge.coordination.model.SubtaskUpdate;
import com.taskforge.coordination.streaming.StreamingEvent;
import com.taskforge.coordination.streaming.StreamingEvent.ContentChunk;
import com.taskforge.coordination.streaming.StreamingEvent.ReasoningChunk;
import com.taskforge.coordination.streaming.StreamingEvent.StatusChange;
import com.taskforge.coordination.streaming.StreamingEvent.StreamStarted;
import com.taskforge.coordination.streaming.StreamingEvent.ThinkingStepUpdate;
import com.taskforge.coordination.streaming.StreamingEvent.ToolFinished;
import com.taskforge.coordination.streaming.StreamingEvent.ToolStarted;
import com.taskforge.coordination.streaming.StreamingEvent.WorkbenchUpdate;
import com.taskforge.coordination.streaming.StreamingEventFormatException;
import com.taskforge.coordination.streaming.StreamingEventParser;
import com.taskforge.coordination.streaming.StreamingSession;
import com.taskforge.coordination.streaming.StreamingSessionRegistry;
import com.taskforge.entity.Subtask;
import com.taskforge.entity.SubtaskStatus;
import com.taskforge.stream.TaskStreamService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

@Service
@Slf4j
public class StreamingIngestServiceImpl implements StreamingIngestService {

    static final String STREAMING_STATUS = "streaming";

    private final StreamingEventParser parser;
    private final StreamingSessionRegistry registry;
    private final StreamingCache cache;
    private final StreamingPersistenceService persistence;
    private final SubtaskUpdateService subtaskUpdateService;
    private final TaskStreamService streamService;
    private final TaskForgeProperties properties;
    private final Clock clock;

    public StreamingIngestServiceImpl(StreamingEventParser parser,
                                      StreamingSessionRegistry registry,
                                      StreamingCache cache,
                                      StreamingPersistenceService persistence,
                                      SubtaskUpdateService subtaskUpdateService,
                                      TaskStreamService streamService,
                                      TaskForgeProperties properties,
                                      Clock clock) {
        this.parser = parser;
        this.registry = registry;
        this.cache = cache;
        this.persistence = persistence;
        this.subtaskUpdateService = subtaskUpdateService;
        this.streamService = streamService;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public StreamingAck process(Long taskId, Long subtaskId, String eventType, @Nullable Map<String, Object> payload) {
        if (taskId == null || subtaskId == null) {
            return StreamingAck.rejected("task_id and subtask_id are required");
        }
        StreamingEvent event;
        try {
            event = parser.parse(eventType, payload);
        } catch (StreamingEventFormatException ex) {
            log.warn("Rejected {} event for subtask {}: {}", eventType, subtaskId, ex.getMessage());
            return StreamingAck.rejected(ex.getMessage());
        }
        try {
            return handle(taskId, subtaskId, event);
        } catch (RuntimeException ex) {
            log.error("Failed to process {} event for subtask {}", eventType, subtaskId, ex);
            return StreamingAck.rejected(ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName());
        }
    }

    private StreamingAck handle(Long taskId, Long subtaskId, StreamingEvent event) {
        if (event instanceof ToolStarted tool) {
            streamService.emitToolStart(taskId, subtaskId, tool.toolId(), tool.toolName(), tool.toolInput());
            return StreamingAck.accepted(null);
        }
        if (event instanceof ToolFinished tool) {
            streamService.emitToolDone(taskId, subtaskId, tool.toolId(), tool.toolOutput(), tool.toolError());
            return StreamingAck.accepted(null);
        }

        long now = clock.millis();
        if (event instanceof StatusChange status && status.isTerminal()) {
            return finishTerminal(taskId, subtaskId, status, now);
        }
        StreamingSessionRegistry.Registration registration = registry.open(taskId, subtaskId, now);
        StreamingSession session = registration.session();
        if (registration.created()) {
            if (!(event instanceof StreamStarted)) {
                Optional<Subtask> stored = persistence.find(subtaskId);
                if (stored.isPresent() && stored.get().getStatus().isTerminal()) {
                    registry.remove(subtaskId);
                    log.warn("Late {} event for subtask {} dropped, subtask is already {}.",
                            event.getClass().getSimpleName(), subtaskId, stored.get().getStatus());
                    return StreamingAck.rejected("subtask is already " + stored.get().getStatus());
                }
                stored.map(Subtask::getResult).ifPresent(result -> resume(session, result));
            }
            initializeCache(session, now);
        }

        Runnable publish = session.withLock(() -> apply(session, event));
        publish.run();
        flushIfDue(session, now);
        return StreamingAck.accepted(session.withLock(session::offset));
    }

    /**
     * Mutates the session and returns the notification to publish once the lock is released.
     */
    private Runnable apply(StreamingSession session, StreamingEvent event) {
        Long taskId = session.getTaskId();
        Long subtaskId = session.getSubtaskId();
        if (event instanceof StreamStarted started) {
            return () -> streamService.emitStart(taskId, subtaskId, started.shellType());
        }
        if (event instanceof ContentChunk chunk) {
            if (chunk.content().isEmpty()) {
                return () -> { };
            }
            long chunkOffset = session.appendContent(chunk.content());
            return () -> streamService.emitChunk(taskId, subtaskId, chunk.content(), chunkOffset, null);
        }
        long offset = session.offset();
        Map<String, Object> result = new LinkedHashMap<>();
        if (event instanceof ReasoningChunk reasoning) {
            if (reasoning.content().isEmpty()) {
                return () -> { };
            }
            session.appendReasoning(reasoning.content());
            result.put(StreamingSession.REASONING_CONTENT, session.reasoningContent());
            result.put("reasoning_chunk", reasoning.content());
        } else if (event instanceof ThinkingStepUpdate thinking) {
            session.upsertThinkingStep(thinking.stepIndex(), thinking.step());
            result.put(StreamingSession.THINKING, session.thinkingCopy());
        } else if (event instanceof WorkbenchUpdate workbench) {
            if (workbench.delta().isEmpty()) {
                return () -> { };
            }
            session.applyWorkbenchDelta(workbench.delta());
            result.put(StreamingSession.WORKBENCH, session.workbenchCopy());
        } else if (event instanceof StatusChange status) {
            session.updateProgress(status.progress());
            result.put("status", status.status().name());
            if (session.progress() != null) {
                result.put("progress", session.progress());
            }
        } else {
            throw new IllegalStateException("Unhandled streaming event " + event.getClass().getSimpleName());
        }
        return () -> streamService.emitChunk(taskId, subtaskId, "", offset, result);
    }

    private void flushIfDue(StreamingSession session, long now) {
        TaskForgeProperties.StreamingConfig config = properties.getStreaming();
        FlushPlan plan = session.withLock(() -> new FlushPlan(
                session.isCacheFlushDue(now, config.getCacheFlushInterval())
                        ? session.toCachedStream(STREAMING_STATUS, now) : null,
                session.isDurableFlushDue(now, config.getDurableFlushInterval())
                        ? session.resultProjection(true) : null,
                session.progress()));

        if (plan.cacheCopy() != null) {
            try {
                cache.write(plan.cacheCopy());
                session.markCacheFlushed(now);
            } catch (RuntimeException ex) {
                log.error("Cache flush failed for subtask {}: {}", session.getSubtaskId(), ex.getMessage());
            }
        }
        if (plan.durableResult() != null) {
            try {
                persistence.saveInFlight(session.getSubtaskId(), plan.durableResult(), plan.progress());
                session.markDurableFlushed(now);
                log.debug("Durable flush for subtask {} done.", session.getSubtaskId());
            } catch (RuntimeException ex) {
                log.error("Durable flush failed for subtask {}: {}", session.getSubtaskId(), ex.getMessage());
            }
        }
    }

    /**
     * Terminal event path. Without a live session (lost ack, reclaimed session, restart) the stored subtask
     * decides: an already finished subtask is acknowledged without writing, a running one is finished from its
     * persisted output.
     */
    private StreamingAck finishTerminal(Long taskId, Long subtaskId, StatusChange status, long now) {
        Optional<StreamingSession> live = registry.find(subtaskId);
        if (live.isPresent()) {
            return finish(live.get(), status);
        }
        Optional<Subtask> stored = persistence.find(subtaskId);
        if (stored.isEmpty()) {
            log.warn("Terminal {} event for unknown subtask {} dropped.", status.status(), subtaskId);
            return StreamingAck.rejected("Subtask not found");
        }
        Subtask subtask = stored.get();
        if (subtask.getStatus().isTerminal()) {
            log.info("Subtask {} is already {}, repeated terminal event acknowledged without writing.", subtaskId,
                    subtask.getStatus());
            Object value = subtask.getResult() != null ? subtask.getResult().get(StreamingSession.VALUE) : null;
            return StreamingAck.accepted(value instanceof String text ? (long) text.length() : 0L);
        }
        StreamingSessionRegistry.Registration registration = registry.open(taskId, subtaskId, now);
        if (registration.created()) {
            resume(registration.session(), subtask.getResult());
        }
        return finish(registration.session(), status);
    }

    private void resume(StreamingSession session, @Nullable Map<String, Object> stored) {
        session.withLock(() -> {
            session.restore(stored);
            return null;
        });
        log.info("Resumed streaming session of subtask {} from stored output (offset={}).", session.getSubtaskId(),
                session.withLock(session::offset));
    }

    private StreamingAck finish(StreamingSession session, StatusChange status) {
        Long taskId = session.getTaskId();
        Long subtaskId = session.getSubtaskId();
        Map<String, Object> result = session.withLock(() -> {
            session.updateProgress(status.progress());
            return session.resultProjection(false);
        });
        if (status.result() != null) {
            result.putAll(status.result());
        }
        result.put(StreamingSession.STREAMING, false);
        long offset = session.withLock(session::offset);

        try {
            subtaskUpdateService.update(SubtaskUpdate.terminal(subtaskId, status.status(), result,
                    status.errorMessage()));
        } catch (RuntimeException ex) {
            log.error("Final write failed for subtask {}, keeping its session: {}", subtaskId, ex.getMessage());
            return StreamingAck.rejected("final write failed: " + ex.getMessage());
        }
        if (status.status() == SubtaskStatus.FAILED) {
            streamService.emitError(taskId, subtaskId, status.errorMessage(), result);
        } else {
            streamService.emitDone(taskId, subtaskId, offset, result);
        }
        try {
            cache.purge(subtaskId);
        } catch (RuntimeException ex) {
            log.error("Failed to purge streaming cache of subtask {}: {}", subtaskId, ex.getMessage());
        }
        registry.remove(subtaskId);
        log.info("Streaming finished for subtask {} of task {} with {} (offset={}).", subtaskId, taskId,
                status.status(), offset);
        return StreamingAck.accepted(offset);
    }

    private void initializeCache(StreamingSession session, long now) {
        try {
            cache.initialize(session.getTaskId(), session.getSubtaskId(), now);
            log.info("Streaming started for subtask {} of task {}.", session.getSubtaskId(), session.getTaskId());
        } catch (RuntimeException ex) {
            log.error("Failed to initialize streaming cache of subtask {}: {}", session.getSubtaskId(),
                    ex.getMessage());
        }
    }

    @Override
    public StreamSnapshot snapshot(Long subtaskId) {
        Optional<StreamingSession> live = registry.find(subtaskId);
        if (live.isPresent()) {
            StreamingSession session = live.get();
            return fromCached(session.withLock(() -> session.toCachedStream(STREAMING_STATUS, clock.millis())),
                    "session");
        }
        Optional<CachedStream> cached = Optional.empty();
        try {
            cached = cache.read(subtaskId);
        } catch (RuntimeException ex) {
            log.warn("Streaming cache unavailable for subtask {}: {}", subtaskId, ex.getMessage());
        }
        if (cached.isPresent()) {
            return fromCached(cached.get(), "cache");
        }
        Subtask subtask = persistence.find(subtaskId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Subtask not found"));
        return fromDurable(subtask);
    }

    @Override
    public CancelState requestCancel(Long subtaskId) {
        Subtask subtask = persistence.find(subtaskId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Subtask not found"));
        boolean flagged = cache.requestCancel(subtaskId);
        streamService.emitCancel(subtask.getTaskId(), subtaskId);
        log.info("Cancel requested for subtask {} of task {} (flag stored: {}).", subtaskId, subtask.getTaskId(),
                flagged);
        return new CancelState(subtask.getTaskId(), subtaskId, flagged);
    }

    @Override
    public CancelState cancelState(Long subtaskId) {
        Subtask subtask = persistence.find(subtaskId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Subtask not found"));
        return new CancelState(subtask.getTaskId(), subtaskId, cache.isCancelRequested(subtaskId));
    }

    @Override
    public int reclaimStaleSessions() {
        List<Long> removed = registry.sweep(clock.millis(), properties.getStreaming().getStaleSessionTimeout());
        if (!removed.isEmpty()) {
            log.info("Reclaimed {} stale streaming sessions: {}", removed.size(), removed);
        }
        return removed.size();
    }

    private static StreamSnapshot fromCached(CachedStream stream, String source) {
        return new StreamSnapshot(stream.taskId(), stream.subtaskId(), stream.status(), stream.content(),
                stream.offset(), stream.reasoningContent(), stream.reasoningOffset(), stream.thinking(),
                stream.workbench(), source);
    }

    @SuppressWarnings("unchecked")
    private static StreamSnapshot fromDurable(Subtask subtask) {
        Map<String, Object> result = subtask.getResult() != null ? subtask.getResult() : Map.of();
        String content = result.get(StreamingSession.VALUE) instanceof String value ? value : "";
        String reasoning = result.get(StreamingSession.REASONING_CONTENT) instanceof String value ? value : "";
        List<Map<String, Object>> thinking = result.get(StreamingSession.THINKING) instanceof List<?> list
                ? (List<Map<String, Object>>) list : List.of();
        Map<String, Object> workbench = result.get(StreamingSession.WORKBENCH) instanceof Map<?, ?> map
                ? (Map<String, Object>) map : Map.of();
        return new StreamSnapshot(subtask.getTaskId(), subtask.getId(), subtask.getStatus().name().toLowerCase(Locale.ROOT),
                content, content.length(), reasoning, reasoning.length(), thinking, workbench, "durable");
    }

    private record FlushPlan(@Nullable CachedStream cacheCopy,
                             @Nullable Map<String, Object> durableResult,
                             @Nullable Integer progress) {
    }
}
