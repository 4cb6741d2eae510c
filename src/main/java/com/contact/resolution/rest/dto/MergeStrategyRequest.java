package com.contact.resolution.rest.dto;

import com.contact.resolution.core.model.ContactField;
import com.contact.resolution.merge.FieldSource;
import com.contact.resolution.merge.MergeStrategy;
import com.contact.resolution.merge.TagMergeMode;

import java.util.Map;

/**
 * Merge strategy as sent over the wire.
 *
 * @param preferPrimary side whose non-empty values win by default; true when absent
 * @param fields        per-field overrides, field name to {@code "primary"} or {@code "secondary"}
 * @param tags          {@code "merge"}, {@code "primary"} or {@code "secondary"}
 */
public record MergeStrategyRequest(
        Boolean preferPrimary,
        Map<String, String> fields,
        String tags
) {
    public MergeStrategyRequest {
        if (fields != null) {
            for (Map.Entry<String, String> entry : fields.entrySet()) {
                if (ContactField.parse(entry.getKey()).isEmpty()) {
                    throw new IllegalArgumentException("Unknown contact field: " + entry.getKey());
                }
                FieldSource.fromWire(entry.getValue());
            }
            fields = Map.copyOf(fields);
        }
        if (tags != null) {
            TagMergeMode.fromWire(tags);
        }
    }

    public MergeStrategy toMergeStrategy() {
        MergeStrategy.Builder builder = MergeStrategy.builder()
                .preferPrimary(preferPrimary == null || preferPrimary);
        if (fields != null) {
            fields.forEach((field, source) -> builder.override(
                    ContactField.parse(field).orElseThrow(), FieldSource.fromWire(source)));
        }
        if (tags != null) {
            builder.tagMode(TagMergeMode.fromWire(tags));
        }
        return builder.build();
    }
}
