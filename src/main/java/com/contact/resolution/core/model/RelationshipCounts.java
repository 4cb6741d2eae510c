package com.contact.resolution.core.model;

import java.util.EnumMap;
import java.util.Map;

/**
 * Number of owned records per record type for one contact (or migrated by one merge).
 */
public record RelationshipCounts(
        long messages,
        long notes,
        long scheduledMessages,
        long analyticsEvents
) {
    public RelationshipCounts {
        if (messages < 0 || notes < 0 || scheduledMessages < 0 || analyticsEvents < 0) {
            throw new IllegalArgumentException("Counts must be non-negative");
        }
    }

    public static RelationshipCounts empty() {
        return new RelationshipCounts(0, 0, 0, 0);
    }

    public static RelationshipCounts of(Map<RecordType, Long> counts) {
        return new RelationshipCounts(
                counts.getOrDefault(RecordType.MESSAGE, 0L),
                counts.getOrDefault(RecordType.NOTE, 0L),
                counts.getOrDefault(RecordType.SCHEDULED_MESSAGE, 0L),
                counts.getOrDefault(RecordType.ANALYTICS_EVENT, 0L));
    }

    public long get(RecordType type) {
        return switch (type) {
            case MESSAGE -> messages;
            case NOTE -> notes;
            case SCHEDULED_MESSAGE -> scheduledMessages;
            case ANALYTICS_EVENT -> analyticsEvents;
        };
    }

    public long total() {
        return messages + notes + scheduledMessages + analyticsEvents;
    }

    public RelationshipCounts plus(RelationshipCounts other) {
        return new RelationshipCounts(
                messages + other.messages,
                notes + other.notes,
                scheduledMessages + other.scheduledMessages,
                analyticsEvents + other.analyticsEvents);
    }

    public Map<RecordType, Long> asMap() {
        Map<RecordType, Long> map = new EnumMap<>(RecordType.class);
        for (RecordType type : RecordType.values()) {
            map.put(type, get(type));
        }
        return map;
    }
}
