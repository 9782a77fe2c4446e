package com.taskforge.entity;

public enum SubtaskRole {
    USER,
    ASSISTANT
}
