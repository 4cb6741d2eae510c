package com.contact.resolution.rules;

import java.util.ArrayList;
import java.util.List;

/**
 * Built-in normalization rules for contact identity fields.
 * Companies get only the generic case and whitespace cleanup.
 */
public final class DefaultNormalizationRules {

    /** Control characters and the punctuation of "Smith, John" or "J. Smith" become spaces. */
    static final List<NormalizationRule> NAME_RULES = List.of(
            NormalizationRule.of("name-control-chars", IdentityField.NAME, "\\p{Cntrl}", " "),
            NormalizationRule.of("name-punctuation", IdentityField.NAME, "[.,;:\"()]", " "));

    static final List<NormalizationRule> EMAIL_RULES = List.of(
            NormalizationRule.of("email-mailto", IdentityField.EMAIL, "^\\s*mailto:", ""),
            NormalizationRule.of("email-whitespace", IdentityField.EMAIL, "\\s+", ""));

    private DefaultNormalizationRules() {
    }

    public static NormalizationEngine createDefaultEngine() {
        List<NormalizationRule> rules = new ArrayList<>(NAME_RULES);
        rules.addAll(EMAIL_RULES);
        return new NormalizationEngine(rules);
    }
}
