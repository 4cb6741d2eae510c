package com.contact.resolution.core.model;

import java.util.Optional;

/**
 * Custom field keys the platform itself writes and reads.
 * Every other key lives in the residual part of {@link CustomFields}.
 */
public enum CustomFieldKey {
    SOURCE("source", ValueType.STRING),
    LEAD_SOURCE("leadSource", ValueType.STRING),
    HUBSPOT_ID("hubspotId", ValueType.STRING),
    SYNCED_FROM_HUBSPOT("syncedFromHubspot", ValueType.BOOLEAN),
    DELETED_IN_HUBSPOT("deletedInHubspot", ValueType.BOOLEAN);

    private final String fieldName;
    private final ValueType valueType;

    CustomFieldKey(String fieldName, ValueType valueType) {
        this.fieldName = fieldName;
        this.valueType = valueType;
    }

    public String fieldName() {
        return fieldName;
    }

    public ValueType valueType() {
        return valueType;
    }

    /**
     * Looks up a recognized key by its JSON field name (case-sensitive).
     */
    public static Optional<CustomFieldKey> fromFieldName(String fieldName) {
        for (CustomFieldKey key : values()) {
            if (key.fieldName.equals(fieldName)) {
                return Optional.of(key);
            }
        }
        return Optional.empty();
    }

    public enum ValueType { STRING, BOOLEAN }
}
