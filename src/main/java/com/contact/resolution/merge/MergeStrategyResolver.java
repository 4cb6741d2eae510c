package com.contact.resolution.merge;

import com.contact.resolution.core.model.Contact;
import com.contact.resolution.core.model.ContactField;
import com.contact.resolution.core.model.CustomFields;

import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Decides the surviving contact's field values. Pure: neither input is modified.
 *
 * <ul>
 *   <li>Scalar fields: an override takes that side's value as is; otherwise the preferred
 *       side's value unless it is blank, then the other side's.</li>
 *   <li>Tags: per {@link TagMergeMode}.</li>
 *   <li>Custom fields: union, the preferred side winning shared keys.</li>
 *   <li>{@code lastContactedAt}: the earlier of the two.</li>
 *   <li>Id, status, createdAt and version stay the primary's.</li>
 * </ul>
 */
public class MergeStrategyResolver {

    public MergePlan resolve(Contact primary, Contact secondary, MergeStrategy strategy) {
        MergeStrategy effective = strategy != null ? strategy : MergeStrategy.defaults();
        FieldSource preferred = effective.preferredSide();

        Contact.Builder builder = Contact.builder(primary);
        Map<ContactField, FieldSource> sources = new EnumMap<>(ContactField.class);

        for (ContactField field : ContactField.values()) {
            FieldSource override = effective.getFieldOverrides().get(field);
            FieldSource chosen;
            if (override != null) {
                chosen = override;
            } else {
                boolean fallBack = isBlank(field.valueOf(pick(preferred, primary, secondary)))
                        && !isBlank(field.valueOf(pick(preferred.other(), primary, secondary)));
                chosen = fallBack ? preferred.other() : preferred;
            }
            field.apply(builder, field.valueOf(pick(chosen, primary, secondary)));
            sources.put(field, chosen);
        }

        builder.tags(resolveTags(primary, secondary, effective.getTagMode()));
        builder.customFields(resolveCustomFields(primary.getCustomFields(), secondary.getCustomFields(), preferred));
        builder.lastContactedAt(earlier(primary.getLastContactedAt(), secondary.getLastContactedAt()));

        return new MergePlan(builder.build(), sources);
    }

    private static Set<String> resolveTags(Contact primary, Contact secondary, TagMergeMode mode) {
        return switch (mode) {
            case PRIMARY -> primary.getTags();
            case SECONDARY -> secondary.getTags();
            case UNION -> {
                Set<String> union = new LinkedHashSet<>(primary.getTags());
                union.addAll(secondary.getTags());
                yield union;
            }
        };
    }

    private static CustomFields resolveCustomFields(CustomFields primary, CustomFields secondary, FieldSource preferred) {
        return preferred == FieldSource.PRIMARY ? primary.mergedWith(secondary) : secondary.mergedWith(primary);
    }

    private static Instant earlier(Instant a, Instant b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return a.isBefore(b) ? a : b;
    }

    private static Contact pick(FieldSource source, Contact primary, Contact secondary) {
        return source == FieldSource.PRIMARY ? primary : secondary;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
