package com.contact.resolution.merge;

import com.contact.resolution.core.model.Contact;
import com.contact.resolution.core.model.ContactField;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Target state of the surviving contact plus where each scalar field came from.
 */
public record MergePlan(Contact resolvedPrimary, Map<ContactField, FieldSource> fieldSources) {

    public MergePlan {
        Objects.requireNonNull(resolvedPrimary, "resolvedPrimary is required");
        fieldSources = fieldSources != null
                ? Collections.unmodifiableMap(new EnumMap<>(fieldSources))
                : Map.of();
    }

    /**
     * Field provenance keyed by wire name, e.g. {@code email -> secondary}.
     */
    public Map<String, String> provenance() {
        Map<String, String> provenance = new LinkedHashMap<>();
        fieldSources.forEach((field, source) -> provenance.put(field.fieldName(), source.wireName()));
        return provenance;
    }
}
