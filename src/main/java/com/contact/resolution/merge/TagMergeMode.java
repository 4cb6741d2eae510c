package com.contact.resolution.merge;

/**
 * How the surviving contact's tags are chosen.
 */
public enum TagMergeMode {
    /** Union of both sides' tags. */
    UNION("merge"),
    /** Keep only the primary's tags. */
    PRIMARY("primary"),
    /** Keep only the secondary's tags. */
    SECONDARY("secondary");

    private final String wireName;

    TagMergeMode(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Accepts the wire names {@code merge}, {@code primary}, {@code secondary} and the constant names.
     */
    public static TagMergeMode fromWire(String value) {
        if (value != null) {
            String trimmed = value.trim();
            for (TagMergeMode mode : values()) {
                if (mode.wireName.equalsIgnoreCase(trimmed) || mode.name().equalsIgnoreCase(trimmed)) {
                    return mode;
                }
            }
        }
        throw new IllegalArgumentException("Unknown tag merge mode: " + value);
    }
}
