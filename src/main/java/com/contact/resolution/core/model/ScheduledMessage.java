package com.contact.resolution.core.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A message queued to be sent to a contact at a later time.
 */
public record ScheduledMessage(
        String id,
        String contactId,
        MessageChannel channel,
        String content,
        Instant scheduledAt,
        ScheduleStatus status,
        Instant createdAt
) implements ContactOwnedRecord {

    public ScheduledMessage {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(contactId, "contactId is required");
        Objects.requireNonNull(channel, "channel is required");
        Objects.requireNonNull(scheduledAt, "scheduledAt is required");
        content = content != null ? content : "";
        status = status != null ? status : ScheduleStatus.PENDING;
        createdAt = createdAt != null ? createdAt : Instant.now();
    }

    public static ScheduledMessage of(String contactId, MessageChannel channel, String content, Instant scheduledAt) {
        return new ScheduledMessage(UUID.randomUUID().toString(), contactId, channel, content,
                scheduledAt, ScheduleStatus.PENDING, Instant.now());
    }

    @Override
    public RecordType recordType() {
        return RecordType.SCHEDULED_MESSAGE;
    }

    @Override
    public ScheduledMessage withContactId(String newContactId) {
        return new ScheduledMessage(id, newContactId, channel, content, scheduledAt, status, createdAt);
    }
}
