package com.taskforge.entity;

public enum TaskStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isDispatchable() {
        return this == PENDING || this == RUNNING;
    }
}
