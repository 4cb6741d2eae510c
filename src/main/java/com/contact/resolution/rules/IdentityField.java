package com.contact.resolution.rules;

/**
 * Identity fields that text normalization rules can be scoped to.
 */
public enum IdentityField {
    NAME,
    EMAIL,
    COMPANY
}
