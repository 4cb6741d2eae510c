package com.contact.resolution.rest.dto;

import com.contact.resolution.core.model.DuplicateCandidate;

import java.util.List;

public record DuplicatesResponse(List<DuplicateCandidateResponse> duplicates) {

    public static DuplicatesResponse from(List<DuplicateCandidate> candidates) {
        return new DuplicatesResponse(candidates.stream().map(DuplicateCandidateResponse::from).toList());
    }
}
