package com.contact.resolution.rest.dto;

import com.contact.resolution.core.model.Contact;
import com.contact.resolution.core.model.RelationshipCounts;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.List;

/**
 * Response DTO for a contact and the records it owns.
 */
public record ContactResponse(
        String id,
        String firstName,
        String lastName,
        String email,
        String phone,
        String whatsapp,
        String company,
        String jobTitle,
        String status,
        List<String> tags,
        JsonNode customFields,
        Instant lastContactedAt,
        Instant createdAt,
        Instant updatedAt,
        long version,
        RelationshipCounts counts
) {
    public static ContactResponse from(Contact contact, RelationshipCounts counts) {
        return new ContactResponse(
                contact.getId(),
                contact.getFirstName(),
                contact.getLastName(),
                contact.getEmail(),
                contact.getPhone(),
                contact.getWhatsapp(),
                contact.getCompany(),
                contact.getJobTitle(),
                contact.getStatus().name(),
                List.copyOf(contact.getTags()),
                contact.getCustomFields().toJson(),
                contact.getLastContactedAt(),
                contact.getCreatedAt(),
                contact.getUpdatedAt(),
                contact.getVersion(),
                counts
        );
    }
}
