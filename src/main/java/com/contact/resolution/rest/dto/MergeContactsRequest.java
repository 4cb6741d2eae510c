package com.contact.resolution.rest.dto;

import com.contact.resolution.merge.MergeStrategy;

/**
 * Request DTO for merging one contact into another.
 */
public record MergeContactsRequest(
        String primaryContactId,
        String secondaryContactId,
        MergeStrategyRequest mergeStrategy
) {
    public MergeContactsRequest {
        if (primaryContactId == null || primaryContactId.isBlank()) {
            throw new IllegalArgumentException("primaryContactId is required");
        }
        if (secondaryContactId == null || secondaryContactId.isBlank()) {
            throw new IllegalArgumentException("secondaryContactId is required");
        }
    }

    public MergeStrategy toMergeStrategy() {
        return mergeStrategy != null ? mergeStrategy.toMergeStrategy() : MergeStrategy.defaults();
    }
}
