package com.taskforge.stream;

import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Typed publishing of task notifications to the live channel.
 */
@Component
public class TaskStreamService {

    public static final String EVENT_START = "start";
    public static final String EVENT_CHUNK = "chunk";
    public static final String EVENT_DONE = "done";
    public static final String EVENT_ERROR = "error";
    public static final String EVENT_TOOL_START = "tool:start";
    public static final String EVENT_TOOL_DONE = "tool:done";
    public static final String EVENT_CANCEL = "cancel";

    private final TaskStreamHub hub;

    public TaskStreamService(TaskStreamHub hub) {
        this.hub = hub;
    }

    public void emitStart(Long taskId, Long subtaskId, String shellType) {
        hub.publish(taskId, EVENT_START, new TaskNotification(taskId, subtaskId, 0L, null, null, null, shellType,
                null, null, null, null, null));
    }

    public void emitChunk(Long taskId, Long subtaskId, String content, long offset, Map<String, Object> result) {
        hub.publish(taskId, EVENT_CHUNK, new TaskNotification(taskId, subtaskId, offset, content, result,
                null, null, null, null, null, null, null));
    }

    public void emitDone(Long taskId, Long subtaskId, long offset, Map<String, Object> result) {
        hub.publishFinal(taskId, EVENT_DONE, new TaskNotification(taskId, subtaskId, offset, null, result,
                null, null, null, null, null, null, null));
    }

    public void emitError(Long taskId, Long subtaskId, String error, Map<String, Object> result) {
        hub.publishFinal(taskId, EVENT_ERROR, new TaskNotification(taskId, subtaskId, null, null, result,
                error, null, null, null, null, null, null));
    }

    public void emitToolStart(Long taskId, Long subtaskId, String toolId, String toolName, Object toolInput) {
        hub.publish(taskId, EVENT_TOOL_START, new TaskNotification(taskId, subtaskId, null, null, null,
                null, null, toolId, toolName, toolInput, null, null));
    }

    public void emitToolDone(Long taskId, Long subtaskId, String toolId, Object toolOutput, String toolError) {
        hub.publish(taskId, EVENT_TOOL_DONE, new TaskNotification(taskId, subtaskId, null, null, null,
                null, null, toolId, null, null, toolOutput, toolError));
    }

    public void emitCancel(Long taskId, Long subtaskId) {
        hub.publish(taskId, EVENT_CANCEL, TaskNotification.of(taskId, subtaskId));
    }
}
