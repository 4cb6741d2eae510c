package com.contact.resolution.core.model;

import java.time.Instant;

/**
 * A record that belongs to exactly one contact through its {@code contactId}.
 * Implementations are immutable; re-pointing produces a copy.
 */
public interface ContactOwnedRecord {

    String id();

    String contactId();

    Instant createdAt();

    RecordType recordType();

    /**
     * Returns a copy of this record owned by another contact.
     */
    ContactOwnedRecord withContactId(String newContactId);
}
