package com.contact.resolution.rules;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Case-insensitive regex rewrite applied to one identity field before comparison.
 */
public record NormalizationRule(String name, IdentityField field, Pattern pattern, String replacement) {

    public NormalizationRule {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(field, "field is required");
        Objects.requireNonNull(pattern, "pattern is required");
        Objects.requireNonNull(replacement, "replacement is required");
    }

    public static NormalizationRule of(String name, IdentityField field, String regex, String replacement) {
        return new NormalizationRule(name, field, Pattern.compile(regex, Pattern.CASE_INSENSITIVE), replacement);
    }

    public String apply(String input) {
        return pattern.matcher(input).replaceAll(replacement);
    }
}
