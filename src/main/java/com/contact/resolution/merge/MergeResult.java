package com.contact.resolution.merge;

import com.contact.resolution.core.model.Contact;
import com.contact.resolution.core.model.ContactField;
import com.contact.resolution.core.model.MergeRecord;
import com.contact.resolution.core.model.RelationshipCounts;

import java.util.Map;
import java.util.Objects;

/**
 * Outcome of a completed merge.
 *
 * @param primary      the surviving contact as committed
 * @param counts       records the primary owns after the merge
 * @param migrated     records moved over from the secondary
 * @param fieldSources which side each scalar field came from
 * @param mergeRecord  the ledger entry written for this merge
 * @param attempts     transaction attempts needed (more than one after a stale primary)
 */
public record MergeResult(
        Contact primary,
        RelationshipCounts counts,
        RelationshipCounts migrated,
        Map<ContactField, FieldSource> fieldSources,
        MergeRecord mergeRecord,
        int attempts
) {
    public MergeResult {
        Objects.requireNonNull(primary, "primary is required");
        counts = counts != null ? counts : RelationshipCounts.empty();
        migrated = migrated != null ? migrated : RelationshipCounts.empty();
        fieldSources = fieldSources != null ? Map.copyOf(fieldSources) : Map.of();
    }

    public MergeState state() {
        return MergeState.COMPLETED;
    }

    public String secondaryContactId() {
        return mergeRecord != null ? mergeRecord.secondaryContactId() : null;
    }
}
