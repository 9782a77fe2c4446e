package com.taskforge.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskforge.config.TaskForgeProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
@Slf4j
public class RedisStreamingCache implements StreamingCache {

    static final String CONTENT_PREFIX = "executor:streaming:";
    static final String STATE_PREFIX = "executor:streaming:state:";
    static final String THINKING_PREFIX = "executor:thinking:";
    static final String WORKBENCH_PREFIX = "executor:workbench:";
    static final String REASONING_PREFIX = "executor:reasoning:";
    static final String CANCEL_PREFIX = "executor:cancel:";

    private static final TypeReference<List<Map<String, Object>>> THINKING_TYPE = new TypeReference<>() {};
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final TaskForgeProperties properties;

    public RedisStreamingCache(StringRedisTemplate redisTemplate,
                               ObjectMapper objectMapper,
                               TaskForgeProperties properties) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public void initialize(Long taskId, Long subtaskId, long startedAt) {
        Duration ttl = properties.getStreaming().getCacheTtl();
        redisTemplate.opsForValue().set(CONTENT_PREFIX + subtaskId, "", ttl);
        redisTemplate.opsForValue().set(STATE_PREFIX + subtaskId,
                toJson(stateRecord(taskId, subtaskId, "streaming", 0, 0, 0, 0, startedAt, startedAt)), ttl);
        log.debug("Initialized streaming cache for subtask {}.", subtaskId);
    }

    @Override
    public void write(CachedStream stream) {
        Duration ttl = properties.getStreaming().getCacheTtl();
        Long subtaskId = stream.subtaskId();
        var ops = redisTemplate.opsForValue();
        ops.set(CONTENT_PREFIX + subtaskId, nullToEmpty(stream.content()), ttl);
        if (stream.reasoningContent() != null && !stream.reasoningContent().isEmpty()) {
            ops.set(REASONING_PREFIX + subtaskId, stream.reasoningContent(), ttl);
        }
        if (stream.thinking() != null && !stream.thinking().isEmpty()) {
            ops.set(THINKING_PREFIX + subtaskId, toJson(stream.thinking()), ttl);
        }
        if (stream.workbench() != null && !stream.workbench().isEmpty()) {
            ops.set(WORKBENCH_PREFIX + subtaskId, toJson(stream.workbench()), ttl);
        }
        int thinkingCount = stream.thinking() != null ? stream.thinking().size() : 0;
        ops.set(STATE_PREFIX + subtaskId, toJson(stateRecord(stream.taskId(), subtaskId, stream.status(),
                stream.offset(), stream.reasoningOffset(), nullToEmpty(stream.content()).length(), thinkingCount,
                stream.startedAt(), stream.lastUpdateAt())), ttl);
        log.debug("Saved streaming cache for subtask {} (offset={}).", subtaskId, stream.offset());
    }

    @Override
    public Optional<CachedStream> read(Long subtaskId) {
        var ops = redisTemplate.opsForValue();
        String stateJson = ops.get(STATE_PREFIX + subtaskId);
        String content = ops.get(CONTENT_PREFIX + subtaskId);
        if (stateJson == null && content == null) {
            return Optional.empty();
        }
        Map<String, Object> state = stateJson != null ? fromJson(stateJson, MAP_TYPE) : Map.of();
        String thinkingJson = ops.get(THINKING_PREFIX + subtaskId);
        String workbenchJson = ops.get(WORKBENCH_PREFIX + subtaskId);
        String reasoning = ops.get(REASONING_PREFIX + subtaskId);
        return Optional.of(new CachedStream(
                asLong(state.get("task_id")),
                subtaskId,
                state.get("status") != null ? state.get("status").toString() : "streaming",
                nullToEmpty(content),
                asLong(state.get("offset"), nullToEmpty(content).length()),
                nullToEmpty(reasoning),
                asLong(state.get("reasoning_offset"), nullToEmpty(reasoning).length()),
                thinkingJson != null ? fromJson(thinkingJson, THINKING_TYPE) : List.of(),
                workbenchJson != null ? fromJson(workbenchJson, MAP_TYPE) : Map.of(),
                asLong(state.get("started_at"), 0L),
                asLong(state.get("last_update_at"), 0L)));
    }

    @Override
    public void purge(Long subtaskId) {
        redisTemplate.delete(List.of(
                CONTENT_PREFIX + subtaskId,
                STATE_PREFIX + subtaskId,
                THINKING_PREFIX + subtaskId,
                WORKBENCH_PREFIX + subtaskId,
                REASONING_PREFIX + subtaskId,
                CANCEL_PREFIX + subtaskId));
        log.debug("Purged streaming cache for subtask {}.", subtaskId);
    }

    @Override
    public boolean requestCancel(Long subtaskId) {
        try {
            redisTemplate.opsForValue().set(CANCEL_PREFIX + subtaskId, "1",
                    properties.getStreaming().getCancelFlagTtl());
            return true;
        } catch (DataAccessException ex) {
            log.error("Failed to set cancel flag for subtask {}: {}", subtaskId, ex.getMessage());
            return false;
        }
    }

    @Override
    public boolean isCancelRequested(Long subtaskId) {
        try {
            return Boolean.TRUE.equals(redisTemplate.hasKey(CANCEL_PREFIX + subtaskId));
        } catch (DataAccessException ex) {
            log.error("Failed to read cancel flag for subtask {}: {}", subtaskId, ex.getMessage());
            return false;
        }
    }

    private Map<String, Object> stateRecord(Long taskId, Long subtaskId, String status, long offset,
                                            long reasoningOffset, int contentLength, int thinkingCount,
                                            long startedAt, long lastUpdateAt) {
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("task_id", taskId);
        state.put("subtask_id", subtaskId);
        state.put("status", status);
        state.put("offset", offset);
        state.put("reasoning_offset", reasoningOffset);
        state.put("content_length", contentLength);
        state.put("thinking_count", thinkingCount);
        state.put("started_at", startedAt);
        state.put("last_update_at", lastUpdateAt);
        return state;
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to encode streaming cache value", ex);
        }
    }

    private <T> T fromJson(String raw, TypeReference<T> type) {
        try {
            return objectMapper.readValue(raw, type);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to decode streaming cache value", ex);
        }
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }

    private static Long asLong(Object value) {
        return value instanceof Number number ? number.longValue() : null;
    }

    private static long asLong(Object value, long fallback) {
        return value instanceof Number number ? number.longValue() : fallback;
    }
}
