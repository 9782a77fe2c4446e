package com.taskforge.coordination.streaming;

import com.taskforge.coordination.streaming.StreamingEvent.ContentChunk;
import com.taskforge.coordination.streaming.StreamingEvent.ReasoningChunk;
import com.taskforge.coordination.streaming.StreamingEvent.StatusChange;
import com.taskforge.coordination.streaming.StreamingEvent.StreamStarted;
import com.taskforge.coordination.streaming.StreamingEvent.ThinkingStepUpdate;
import com.taskforge.coordination.streaming.StreamingEvent.ToolFinished;
import com.taskforge.coordination.streaming.StreamingEvent.ToolStarted;
import com.taskforge.coordination.streaming.StreamingEvent.WorkbenchUpdate;
import com.taskforge.entity.SubtaskStatus;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Turns the raw {@code event_type}/{@code payload} pair sent by a worker into a typed {@link StreamingEvent}.
 * Every shape check happens here so the ingest path only deals with valid variants.
 */
@Component
public class StreamingEventParser {

    static final String DEFAULT_ERROR_MESSAGE = "Execution failed";

    public StreamingEvent parse(String eventType, @Nullable Map<String, Object> payload) {
        StreamingEventType type = StreamingEventType.fromWireName(eventType)
                .orElseThrow(() -> new StreamingEventFormatException("Unknown event type: " + eventType));
        Map<String, Object> data = payload != null ? payload : Map.of();
        return switch (type) {
            case START -> new StreamStarted(optionalString(data, "shell_type"));
            case CHUNK -> new ContentChunk(stringOrEmpty(data, "content"));
            case REASONING -> new ReasoningChunk(stringOrEmpty(data, "content"));
            case THINKING -> new ThinkingStepUpdate(optionalIndex(data), requiredObject(data, "step"));
            case WORKBENCH_DELTA -> new WorkbenchUpdate(WorkbenchDelta.from(requiredObject(data, "delta")));
            case STATUS -> statusChange(data, null);
            case DONE -> statusChange(data, SubtaskStatus.COMPLETED);
            case ERROR -> errorEvent(data);
            case TOOL_START -> new ToolStarted(optionalString(data, "tool_id"), optionalString(data, "tool_name"),
                    data.get("tool_input"));
            case TOOL_DONE -> new ToolFinished(optionalString(data, "tool_id"), data.get("tool_output"),
                    optionalString(data, "tool_error"));
        };
    }

    private StatusChange statusChange(Map<String, Object> data, @Nullable SubtaskStatus fallback) {
        String raw = optionalString(data, "status");
        SubtaskStatus status = raw != null ? parseStatus(raw) : fallback;
        if (status == null) {
            throw new StreamingEventFormatException("status event requires a status");
        }
        return new StatusChange(status, optionalInteger(data, "progress"), optionalString(data, "error_message"),
                optionalObject(data, "result"));
    }

    private StatusChange errorEvent(Map<String, Object> data) {
        String message = optionalString(data, "error_message");
        if (message == null) {
            message = optionalString(data, "error");
        }
        return new StatusChange(SubtaskStatus.FAILED, optionalInteger(data, "progress"),
                message != null ? message : DEFAULT_ERROR_MESSAGE, optionalObject(data, "result"));
    }

    static SubtaskStatus parseStatus(String raw) {
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        if ("CANCELED".equals(normalized)) {
            return SubtaskStatus.CANCELLED;
        }
        try {
            return SubtaskStatus.valueOf(normalized);
        } catch (IllegalArgumentException ex) {
            throw new StreamingEventFormatException("Unknown status: " + raw);
        }
    }

    private static String stringOrEmpty(Map<String, Object> data, String key) {
        String value = optionalString(data, key);
        return value != null ? value : "";
    }

    private static @Nullable String optionalString(Map<String, Object> data, String key) {
        Object value = data.get(key);
        return value != null ? value.toString() : null;
    }

    private static @Nullable Integer optionalInteger(Map<String, Object> data, String key) {
        Object value = data.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException ex) {
            throw new StreamingEventFormatException(key + " must be a number");
        }
    }

    private static @Nullable Integer optionalIndex(Map<String, Object> data) {
        Integer index = optionalInteger(data, "step_index");
        if (index != null && index < 0) {
            throw new StreamingEventFormatException("step_index must not be negative");
        }
        return index;
    }

    private static Map<String, Object> requiredObject(Map<String, Object> data, String key) {
        Map<String, Object> value = optionalObject(data, key);
        if (value == null) {
            throw new StreamingEventFormatException(key + " is required");
        }
        return value;
    }

    @SuppressWarnings("unchecked")
    private static @Nullable Map<String, Object> optionalObject(Map<String, Object> data, String key) {
        Object value = data.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Map<?, ?>)) {
            throw new StreamingEventFormatException(key + " must be an object");
        }
        return new LinkedHashMap<>((Map<String, Object>) value);
    }
}
