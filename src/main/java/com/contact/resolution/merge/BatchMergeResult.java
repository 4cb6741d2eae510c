package com.contact.resolution.merge;

import com.contact.resolution.core.exception.ErrorKind;
import com.contact.resolution.core.model.Contact;
import com.contact.resolution.core.model.RelationshipCounts;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of merging several secondaries into one primary, in order, stopping at the first failure.
 * Merges completed before the failure stay committed.
 *
 * @param mergedIds      secondaries merged, in request order
 * @param failedId       the secondary whose merge failed, or null if all succeeded
 * @param failureKind    why it failed, or null
 * @param failureMessage failure detail, or null
 * @param notAttempted   secondaries after the failed one
 * @param primary        latest state of the primary, null if it does not exist
 * @param counts         records the primary owns now
 */
public record BatchMergeResult(
        String primaryId,
        List<String> mergedIds,
        String failedId,
        ErrorKind failureKind,
        String failureMessage,
        List<String> notAttempted,
        Contact primary,
        RelationshipCounts counts
) {
    public BatchMergeResult {
        mergedIds = mergedIds != null ? List.copyOf(mergedIds) : List.of();
        notAttempted = notAttempted != null ? List.copyOf(notAttempted) : List.of();
        counts = counts != null ? counts : RelationshipCounts.empty();
    }

    public int mergedCount() {
        return mergedIds.size();
    }

    public boolean isComplete() {
        return failedId == null;
    }

    public Optional<String> failure() {
        return Optional.ofNullable(failureMessage);
    }
}
