package com.taskforge.coordination.model;

import java.util.List;

public record DispatchBatch(
        List<ExecutionContext> tasks,
        List<DispatchSkip> skipped
) {

    public static DispatchBatch empty() {
        return new DispatchBatch(List.of(), List.of());
    }
}
