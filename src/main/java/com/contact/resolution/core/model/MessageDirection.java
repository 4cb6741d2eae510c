package com.contact.resolution.core.model;

public enum MessageDirection {
    INBOUND,
    OUTBOUND
}
