package com.taskforge.coordination.model;

public record CancelState(Long taskId, Long subtaskId, boolean cancelRequested) {
}
