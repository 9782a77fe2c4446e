package com.taskforge.coordination.streaming;

import com.taskforge.entity.SubtaskStatus;
import org.springframework.lang.Nullable;

import java.util.Map;

/**
 * A validated streaming event. Each variant carries only the fields its handler needs.
 */
public interface StreamingEvent {

    record StreamStarted(@Nullable String shellType) implements StreamingEvent {
    }

    record ContentChunk(String content) implements StreamingEvent {
    }

    record ReasoningChunk(String content) implements StreamingEvent {
    }

    /**
     * @param stepIndex position to upsert; {@code null} appends
     */
    record ThinkingStepUpdate(@Nullable Integer stepIndex, Map<String, Object> step) implements StreamingEvent {
    }

    record WorkbenchUpdate(WorkbenchDelta delta) implements StreamingEvent {
    }

    record StatusChange(SubtaskStatus status,
                        @Nullable Integer progress,
                        @Nullable String errorMessage,
                        @Nullable Map<String, Object> result) implements StreamingEvent {

        public boolean isTerminal() {
            return status.isTerminal();
        }
    }

    record ToolStarted(@Nullable String toolId, @Nullable String toolName, @Nullable Object toolInput)
            implements StreamingEvent {
    }

    record ToolFinished(@Nullable String toolId, @Nullable Object toolOutput, @Nullable String toolError)
            implements StreamingEvent {
    }
}
