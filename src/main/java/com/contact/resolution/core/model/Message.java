package com.contact.resolution.core.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A message exchanged with a contact on any channel.
 */
public record Message(
        String id,
        String contactId,
        MessageChannel channel,
        MessageDirection direction,
        MessageStatus status,
        String content,
        Instant createdAt
) implements ContactOwnedRecord {

    public Message {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(contactId, "contactId is required");
        Objects.requireNonNull(channel, "channel is required");
        Objects.requireNonNull(direction, "direction is required");
        status = status != null ? status : MessageStatus.PENDING;
        content = content != null ? content : "";
        createdAt = createdAt != null ? createdAt : Instant.now();
    }

    /**
     * Creates a new message with a generated id.
     */
    public static Message of(String contactId, MessageChannel channel, MessageDirection direction, String content) {
        return new Message(UUID.randomUUID().toString(), contactId, channel, direction,
                MessageStatus.PENDING, content, Instant.now());
    }

    @Override
    public RecordType recordType() {
        return RecordType.MESSAGE;
    }

    @Override
    public Message withContactId(String newContactId) {
        return new Message(id, newContactId, channel, direction, status, content, createdAt);
    }
}
