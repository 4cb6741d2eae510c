package com.contact.resolution.rest.dto;

import com.contact.resolution.core.model.IdentityTuple;

/**
 * Request DTO for a duplicate search. At least one of name, email or phone must be given.
 */
public record FindDuplicatesRequest(
        String firstName,
        String lastName,
        String email,
        String phone,
        String company,
        String excludeContactId
) {
    public IdentityTuple toIdentityTuple() {
        return new IdentityTuple(firstName, lastName, email, phone, company);
    }
}
