package com.contact.resolution.core.model;

public enum MessageStatus {
    PENDING,
    SENT,
    DELIVERED,
    READ,
    FAILED,
    QUEUED
}
