package com.taskforge.api;

import com.taskforge.coordination.model.DispatchBatch;
import com.taskforge.coordination.model.DispatchSkip;
import com.taskforge.coordination.model.ExecutionContext;

import java.util.List;

public record DispatchResponse(
        List<ExecutionContext> tasks,
        List<DispatchSkip> skipped
) {
    public static DispatchResponse from(DispatchBatch batch) {
        return new DispatchResponse(batch.tasks(), batch.skipped());
    }
}
