package com.contact.resolution.core.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A tracked analytics event attributed to a contact, e.g. {@code contact_created}.
 */
public record AnalyticsEvent(
        String id,
        String contactId,
        MessageChannel channel,
        String eventType,
        Instant createdAt
) implements ContactOwnedRecord {

    public AnalyticsEvent {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(contactId, "contactId is required");
        Objects.requireNonNull(eventType, "eventType is required");
        channel = channel != null ? channel : MessageChannel.SMS;
        createdAt = createdAt != null ? createdAt : Instant.now();
    }

    public static AnalyticsEvent of(String contactId, MessageChannel channel, String eventType) {
        return new AnalyticsEvent(UUID.randomUUID().toString(), contactId, channel, eventType, Instant.now());
    }

    @Override
    public RecordType recordType() {
        return RecordType.ANALYTICS_EVENT;
    }

    @Override
    public AnalyticsEvent withContactId(String newContactId) {
        return new AnalyticsEvent(id, newContactId, channel, eventType, createdAt);
    }
}
