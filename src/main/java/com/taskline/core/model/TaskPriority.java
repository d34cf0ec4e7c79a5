package com.taskline.core.model;

public enum TaskPriority {
    LOW,
    MEDIUM,
    HIGH,
    URGENT
}
