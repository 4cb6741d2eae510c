package com.contact.resolution.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A contact that likely represents the same person as a searched identity tuple.
 * Ephemeral: computed per search and never persisted.
 */
public record DuplicateCandidate(
        String contactId,
        String firstName,
        String lastName,
        String email,
        String phone,
        String company,
        Instant lastContactedAt,
        Instant createdAt,
        double similarity,
        List<MatchReason> matchReasons
) {
    public DuplicateCandidate {
        Objects.requireNonNull(contactId, "contactId is required");
        if (similarity < 0.0 || similarity > 1.0) {
            throw new IllegalArgumentException("similarity must be between 0.0 and 1.0");
        }
        matchReasons = matchReasons != null ? List.copyOf(matchReasons) : List.of();
    }

    public static DuplicateCandidate of(Contact contact, double similarity, List<MatchReason> matchReasons) {
        return new DuplicateCandidate(
                contact.getId(),
                contact.getFirstName(),
                contact.getLastName(),
                contact.getEmail(),
                contact.getPhone(),
                contact.getCompany(),
                contact.getLastContactedAt(),
                contact.getCreatedAt(),
                similarity,
                matchReasons
        );
    }

    public boolean hasExactMatch() {
        return matchReasons.stream().anyMatch(MatchReason::isExact);
    }
}
