package com.contact.resolution.core.model;

/**
 * Signals that contributed to a duplicate score.
 * Declaration order is the order reasons are reported in.
 */
public enum MatchReason {
    EXACT_EMAIL("exact-email"),
    EXACT_PHONE("exact-phone"),
    FUZZY_NAME("fuzzy-name"),
    COMPANY_MATCH("company-match");

    private final String tag;

    MatchReason(String tag) {
        this.tag = tag;
    }

    /**
     * Wire representation, e.g. {@code exact-email}.
     */
    public String tag() {
        return tag;
    }

    /**
     * Returns true for the strong exact signals that qualify a pair on their own.
     */
    public boolean isExact() {
        return this == EXACT_EMAIL || this == EXACT_PHONE;
    }
}
