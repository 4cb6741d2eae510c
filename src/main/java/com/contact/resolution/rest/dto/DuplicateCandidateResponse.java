package com.contact.resolution.rest.dto;

import com.contact.resolution.core.model.DuplicateCandidate;
import com.contact.resolution.core.model.MatchReason;

import java.util.List;

/**
 * One duplicate candidate. {@code matchReason} holds the reason tags, e.g. {@code "exact-email"}.
 */
public record DuplicateCandidateResponse(
        String contactId,
        String firstName,
        String lastName,
        String email,
        String phone,
        String company,
        double similarity,
        List<String> matchReason
) {
    public static DuplicateCandidateResponse from(DuplicateCandidate candidate) {
        return new DuplicateCandidateResponse(
                candidate.contactId(),
                candidate.firstName(),
                candidate.lastName(),
                candidate.email(),
                candidate.phone(),
                candidate.company(),
                candidate.similarity(),
                candidate.matchReasons().stream().map(MatchReason::tag).toList()
        );
    }
}
