package com.contact.resolution.core.model;

/**
 * The subset of contact fields used for similarity scoring.
 * Every component is optional; blank strings are treated like missing values.
 */
public record IdentityTuple(
        String firstName,
        String lastName,
        String email,
        String phone,
        String company
) {
    public static IdentityTuple of(String firstName, String lastName, String email, String phone) {
        return new IdentityTuple(firstName, lastName, email, phone, null);
    }

    /**
     * Returns true when at least one of name, email or phone carries a value.
     * Company alone never identifies a person.
     */
    public boolean hasIdentifyingField() {
        return hasText(firstName) || hasText(lastName) || hasText(email) || hasText(phone);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
