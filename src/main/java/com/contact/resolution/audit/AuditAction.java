package com.contact.resolution.audit;

/**
 * Auditable actions of the merge pipeline.
 */
public enum AuditAction {
    CONTACT_MERGED,
    RELATIONSHIPS_MIGRATED,
    MERGE_FAILED,
    BATCH_MERGE_STOPPED
}
