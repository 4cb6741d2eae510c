package com.contact.resolution.merge;

import com.contact.resolution.core.exception.MigrationFailureException;
import com.contact.resolution.core.model.RecordType;
import com.contact.resolution.store.StoreTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Re-points every record owned by the secondary contact to the primary, one set-based
 * reassignment per record type, inside the caller's transaction. The records actually
 * moved are counted by the transaction when it commits.
 */
public class RelationshipMigrator {
    private static final Logger log = LoggerFactory.getLogger(RelationshipMigrator.class);

    /**
     * @throws MigrationFailureException if any reassignment fails; the transaction then commits nothing
     */
    public void migrate(StoreTransaction tx, String secondaryContactId, String primaryContactId) {
        for (RecordType type : RecordType.values()) {
            try {
                reassign(tx, type, secondaryContactId, primaryContactId);
            } catch (RuntimeException e) {
                log.warn("migration.failed recordType={} secondaryId={} primaryId={} error={}",
                        type, secondaryContactId, primaryContactId, e.getMessage());
                throw new MigrationFailureException(
                        "Failed to move " + type.label() + " records from " + secondaryContactId
                                + " to " + primaryContactId, MergeState.MIGRATING, e);
            }
        }
        log.debug("migration.staged secondaryId={} primaryId={}", secondaryContactId, primaryContactId);
    }

    protected void reassign(StoreTransaction tx, RecordType type, String fromContactId, String toContactId) {
        tx.reassignRecords(type, fromContactId, toContactId);
    }
}
