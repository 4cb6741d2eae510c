package com.contact.resolution.similarity;

import com.contact.resolution.core.model.MatchReason;

import java.util.List;

/**
 * Outcome of comparing two identity tuples: a score in [0, 1] and the signals that fired,
 * in {@link MatchReason} declaration order.
 */
public record SimilarityScore(double score, List<MatchReason> reasons) {

    private static final SimilarityScore NONE = new SimilarityScore(0.0, List.of());

    public SimilarityScore {
        if (score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("score must be between 0.0 and 1.0");
        }
        reasons = reasons != null ? List.copyOf(reasons) : List.of();
    }

    public static SimilarityScore none() {
        return NONE;
    }

    public boolean hasExactMatch() {
        return reasons.stream().anyMatch(MatchReason::isExact);
    }

    public boolean has(MatchReason reason) {
        return reasons.contains(reason);
    }
}
