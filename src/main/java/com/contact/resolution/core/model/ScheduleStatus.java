package com.contact.resolution.core.model;

public enum ScheduleStatus {
    PENDING,
    SENT,
    FAILED,
    CANCELLED
}
