package com.contact.resolution.discovery;

import com.contact.resolution.core.model.DuplicateCandidate;

import java.util.Comparator;

/**
 * Ranking of duplicate candidates: highest score first, then the most recently contacted
 * (never-contacted last), then the oldest record, then by id so the order is total.
 */
public final class CandidateOrdering {

    public static final Comparator<DuplicateCandidate> RANKING = Comparator
            .comparingDouble(DuplicateCandidate::similarity).reversed()
            .thenComparing(DuplicateCandidate::lastContactedAt, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(DuplicateCandidate::createdAt, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(DuplicateCandidate::contactId);

    private CandidateOrdering() {
    }
}
