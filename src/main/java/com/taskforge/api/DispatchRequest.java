package com.taskforge.api;

import com.taskforge.entity.SubtaskStatus;
import jakarta.validation.constraints.Positive;

import java.util.List;

public record DispatchRequest(
        SubtaskStatus status,
        @Positive Integer limit,
        List<Long> taskIds
) {
}
