package com.contact.resolution.audit;

import com.contact.resolution.core.exception.ErrorKind;
import com.contact.resolution.core.model.RelationshipCounts;
import com.contact.resolution.merge.MergeState;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * One line of the merge audit trail.
 *
 * <p>Which of the optional parts are set depends on the action: a completed merge names its
 * ledger record, a migration carries the moved counts, failures carry the error kind and
 * the state the merge failed in.</p>
 *
 * @param secondaryContactId the contact merged away, or for a stopped batch the id that failed
 * @param batchId            set only for entries written by a batch merge
 */
public record AuditEntry(
        String id,
        AuditAction action,
        Instant timestamp,
        String actorId,
        String primaryContactId,
        String secondaryContactId,
        String mergeRecordId,
        RelationshipCounts migrated,
        ErrorKind errorKind,
        MergeState failedState,
        String batchId,
        String message
) {
    public AuditEntry {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(action, "action is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        Objects.requireNonNull(primaryContactId, "primaryContactId is required");
    }

    public static AuditEntry contactMerged(String primaryId, String secondaryId, String actorId,
                                           String mergeRecordId) {
        return new AuditEntry(newId(), AuditAction.CONTACT_MERGED, Instant.now(), actorId,
                primaryId, secondaryId, mergeRecordId, null, null, null, null, null);
    }

    public static AuditEntry relationshipsMigrated(String primaryId, String secondaryId, String actorId,
                                                   RelationshipCounts migrated) {
        return new AuditEntry(newId(), AuditAction.RELATIONSHIPS_MIGRATED, Instant.now(), actorId,
                primaryId, secondaryId, null, Objects.requireNonNull(migrated, "migrated is required"),
                null, null, null, null);
    }

    public static AuditEntry mergeFailed(String primaryId, String secondaryId, String actorId,
                                         ErrorKind errorKind, MergeState failedState, String message) {
        return new AuditEntry(newId(), AuditAction.MERGE_FAILED, Instant.now(), actorId,
                primaryId, secondaryId, null, null, errorKind, failedState, null, message);
    }

    public static AuditEntry batchStopped(String batchId, String primaryId, String failedId, String actorId,
                                          ErrorKind errorKind, int merged, int notAttempted) {
        return new AuditEntry(newId(), AuditAction.BATCH_MERGE_STOPPED, Instant.now(), actorId,
                primaryId, failedId, null, null, errorKind, null, batchId,
                "merged=" + merged + " notAttempted=" + notAttempted);
    }

    public Optional<RelationshipCounts> migratedCounts() {
        return Optional.ofNullable(migrated);
    }

    public Optional<ErrorKind> error() {
        return Optional.ofNullable(errorKind);
    }

    /**
     * True if the entry concerns the contact on either side of the merge.
     */
    public boolean involves(String contactId) {
        return primaryContactId.equals(contactId) || contactId.equals(secondaryContactId);
    }

    private static String newId() {
        return UUID.randomUUID().toString();
    }
}
