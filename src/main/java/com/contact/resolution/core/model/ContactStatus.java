package com.contact.resolution.core.model;

/**
 * Lifecycle status of a contact.
 * A merge keeps the primary's status; the secondary is deleted rather than re-flagged.
 */
public enum ContactStatus {
    LEAD,
    ACTIVE,
    INACTIVE,
    BLOCKED,
    UNSUBSCRIBED
}
