package com.contact.resolution.merge;

import com.contact.resolution.core.model.ContactField;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Caller preferences for resolving field conflicts in a merge.
 *
 * <p>Scalar fields come from the preferred side when it has a value, otherwise from the
 * other side. A field override pins a field to one side regardless of emptiness.</p>
 */
public final class MergeStrategy {

    private static final MergeStrategy DEFAULTS = builder().build();

    private final boolean preferPrimary;
    private final Map<ContactField, FieldSource> fieldOverrides;
    private final TagMergeMode tagMode;

    private MergeStrategy(Builder builder) {
        this.preferPrimary = builder.preferPrimary;
        this.fieldOverrides = Collections.unmodifiableMap(new EnumMap<>(builder.fieldOverrides));
        this.tagMode = builder.tagMode;
    }

    /**
     * Prefer the primary, no overrides, union of tags.
     */
    public static MergeStrategy defaults() {
        return DEFAULTS;
    }

    public boolean isPreferPrimary() {
        return preferPrimary;
    }

    public FieldSource preferredSide() {
        return preferPrimary ? FieldSource.PRIMARY : FieldSource.SECONDARY;
    }

    public Map<ContactField, FieldSource> getFieldOverrides() {
        return fieldOverrides;
    }

    public TagMergeMode getTagMode() {
        return tagMode;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MergeStrategy that = (MergeStrategy) o;
        return preferPrimary == that.preferPrimary
                && fieldOverrides.equals(that.fieldOverrides)
                && tagMode == that.tagMode;
    }

    @Override
    public int hashCode() {
        return Objects.hash(preferPrimary, fieldOverrides, tagMode);
    }

    @Override
    public String toString() {
        return "MergeStrategy{" +
                "preferPrimary=" + preferPrimary +
                ", fieldOverrides=" + fieldOverrides +
                ", tagMode=" + tagMode +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean preferPrimary = true;
        private final Map<ContactField, FieldSource> fieldOverrides = new EnumMap<>(ContactField.class);
        private TagMergeMode tagMode = TagMergeMode.UNION;

        public Builder preferPrimary(boolean preferPrimary) {
            this.preferPrimary = preferPrimary;
            return this;
        }

        public Builder override(ContactField field, FieldSource source) {
            fieldOverrides.put(Objects.requireNonNull(field, "field is required"),
                    Objects.requireNonNull(source, "source is required"));
            return this;
        }

        public Builder fieldOverrides(Map<ContactField, FieldSource> overrides) {
            fieldOverrides.clear();
            if (overrides != null) {
                overrides.forEach(this::override);
            }
            return this;
        }

        public Builder tagMode(TagMergeMode tagMode) {
            this.tagMode = Objects.requireNonNull(tagMode, "tagMode is required");
            return this;
        }

        public MergeStrategy build() {
            return new MergeStrategy(this);
        }
    }
}
