package com.contact.resolution.rest.dto;

import com.contact.resolution.core.model.RelationshipCounts;
import com.contact.resolution.merge.MergeResult;

/**
 * Response DTO for a completed merge.
 *
 * @param counts   records the surviving contact owns
 * @param migrated records moved from the merged-away contact
 */
public record MergeResponse(
        boolean success,
        ContactResponse contact,
        RelationshipCounts counts,
        RelationshipCounts migrated,
        String message
) {
    public static MergeResponse from(MergeResult result) {
        return new MergeResponse(
                true,
                ContactResponse.from(result.primary(), result.counts()),
                result.counts(),
                result.migrated(),
                "Merged contact " + result.secondaryContactId() + " into " + result.primary().getId()
                        + ", migrated " + result.migrated().total() + " records"
        );
    }
}
