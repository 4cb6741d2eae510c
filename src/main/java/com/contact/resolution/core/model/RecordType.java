package com.contact.resolution.core.model;

/**
 * The kinds of records owned by a contact through their {@code contactId}.
 * A merge re-points every one of these from the secondary to the primary.
 */
public enum RecordType {
    MESSAGE("Message"),
    NOTE("Note"),
    SCHEDULED_MESSAGE("ScheduledMessage"),
    ANALYTICS_EVENT("AnalyticsEvent");

    private final String label;

    RecordType(String label) {
        this.label = label;
    }

    /**
     * Node label used by the graph store.
     */
    public String label() {
        return label;
    }
}
