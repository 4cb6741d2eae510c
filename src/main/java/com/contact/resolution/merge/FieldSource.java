package com.contact.resolution.merge;

import java.util.Locale;

/**
 * Which side of a merge a resolved value comes from.
 */
public enum FieldSource {
    PRIMARY,
    SECONDARY;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public FieldSource other() {
        return this == PRIMARY ? SECONDARY : PRIMARY;
    }

    /**
     * Parses {@code "primary"} or {@code "secondary"}, ignoring case.
     */
    public static FieldSource fromWire(String value) {
        if (value != null) {
            for (FieldSource source : values()) {
                if (source.name().equalsIgnoreCase(value.trim())) {
                    return source;
                }
            }
        }
        throw new IllegalArgumentException("Unknown field source: " + value);
    }
}
