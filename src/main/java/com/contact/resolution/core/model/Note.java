package com.contact.resolution.core.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * An internal note left on a contact by a team member.
 */
public record Note(
        String id,
        String contactId,
        String userId,
        String content,
        NoteVisibility visibility,
        Instant createdAt
) implements ContactOwnedRecord {

    public Note {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(contactId, "contactId is required");
        content = content != null ? content : "";
        visibility = visibility != null ? visibility : NoteVisibility.PUBLIC;
        createdAt = createdAt != null ? createdAt : Instant.now();
    }

    public static Note of(String contactId, String userId, String content) {
        return new Note(UUID.randomUUID().toString(), contactId, userId, content,
                NoteVisibility.PUBLIC, Instant.now());
    }

    @Override
    public RecordType recordType() {
        return RecordType.NOTE;
    }

    @Override
    public Note withContactId(String newContactId) {
        return new Note(id, newContactId, userId, content, visibility, createdAt);
    }
}
