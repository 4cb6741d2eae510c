package com.contact.resolution.core.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable ledger entry for a completed contact merge.
 * Records what happened; it carries nothing needed to reverse the merge.
 *
 * @param fieldSources field name to the side ({@code primary} or {@code secondary}) its value came from
 */
public record MergeRecord(
        String id,
        String primaryContactId,
        String secondaryContactId,
        String secondaryDisplayName,
        RelationshipCounts migrated,
        Map<String, String> fieldSources,
        String triggeredBy,
        Instant timestamp
) {
    public MergeRecord {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(primaryContactId, "primaryContactId is required");
        Objects.requireNonNull(secondaryContactId, "secondaryContactId is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        migrated = migrated != null ? migrated : RelationshipCounts.empty();
        fieldSources = fieldSources != null ? Map.copyOf(fieldSources) : Map.of();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id = UUID.randomUUID().toString();
        private String primaryContactId;
        private String secondaryContactId;
        private String secondaryDisplayName;
        private RelationshipCounts migrated;
        private Map<String, String> fieldSources;
        private String triggeredBy;
        private Instant timestamp = Instant.now();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder primaryContactId(String primaryContactId) {
            this.primaryContactId = primaryContactId;
            return this;
        }

        public Builder secondaryContactId(String secondaryContactId) {
            this.secondaryContactId = secondaryContactId;
            return this;
        }

        public Builder secondaryDisplayName(String secondaryDisplayName) {
            this.secondaryDisplayName = secondaryDisplayName;
            return this;
        }

        public Builder migrated(RelationshipCounts migrated) {
            this.migrated = migrated;
            return this;
        }

        public Builder fieldSources(Map<String, String> fieldSources) {
            this.fieldSources = fieldSources;
            return this;
        }

        public Builder triggeredBy(String triggeredBy) {
            this.triggeredBy = triggeredBy;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public MergeRecord build() {
            return new MergeRecord(id, primaryContactId, secondaryContactId, secondaryDisplayName,
                    migrated, fieldSources, triggeredBy, timestamp);
        }
    }
}
