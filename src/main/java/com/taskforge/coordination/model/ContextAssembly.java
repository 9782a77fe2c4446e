package com.taskforge.coordination.model;

import org.springframework.lang.Nullable;

/**
 * Outcome of assembling the context of one claimed subtask: either a context or a skip.
 */
public record ContextAssembly(
        @Nullable ExecutionContext context,
        @Nullable DispatchSkip skip
) {

    public static ContextAssembly assembled(ExecutionContext context) {
        return new ContextAssembly(context, null);
    }

    public static ContextAssembly skipped(Long taskId, Long subtaskId, String reason) {
        return new ContextAssembly(null, new DispatchSkip(taskId, subtaskId, reason));
    }

    public boolean isAssembled() {
        return context != null;
    }
}
