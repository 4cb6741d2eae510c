package com.contact.resolution.rest.dto;

import com.contact.resolution.merge.BatchMergeResult;

import java.util.List;

/**
 * Response DTO for a batch merge. {@code failedId} and {@code failure} are null when every merge succeeded.
 */
public record BatchMergeResponse(
        boolean success,
        int merged,
        List<String> mergedIds,
        String failedId,
        ErrorResponse failure,
        List<String> notAttempted,
        ContactResponse contact
) {
    public static BatchMergeResponse from(BatchMergeResult result, String path) {
        ErrorResponse failure = result.failureKind() != null
                ? ErrorResponse.of(result.failureKind(), result.failureMessage(), path)
                : null;
        return new BatchMergeResponse(
                result.isComplete(),
                result.mergedCount(),
                result.mergedIds(),
                result.failedId(),
                failure,
                result.notAttempted(),
                result.primary() != null ? ContactResponse.from(result.primary(), result.counts()) : null
        );
    }
}
