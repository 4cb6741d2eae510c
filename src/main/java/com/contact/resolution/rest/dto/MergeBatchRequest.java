package com.contact.resolution.rest.dto;

import java.util.List;

/**
 * Request DTO for merging several duplicates into one primary.
 */
public record MergeBatchRequest(
        String primaryId,
        List<String> duplicateIds
) {
    public MergeBatchRequest {
        if (primaryId == null || primaryId.isBlank()) {
            throw new IllegalArgumentException("primaryId is required");
        }
        if (duplicateIds == null || duplicateIds.isEmpty()) {
            throw new IllegalArgumentException("duplicateIds must not be empty");
        }
        duplicateIds = List.copyOf(duplicateIds);
    }
}
