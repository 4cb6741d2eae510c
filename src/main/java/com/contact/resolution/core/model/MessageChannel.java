package com.contact.resolution.core.model;

/**
 * Channels a message, scheduled send or analytics event can belong to.
 */
public enum MessageChannel {
    SMS,
    WHATSAPP,
    EMAIL,
    TWITTER,
    FACEBOOK,
    VOICE
}
