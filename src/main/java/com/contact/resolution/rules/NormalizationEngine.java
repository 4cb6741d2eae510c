package com.contact.resolution.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Normalizes identity values before comparison.
 * The field's rules run in the order given, then the value is lowercased,
 * trimmed and has its whitespace collapsed.
 */
public class NormalizationEngine {
    private static final Logger log = LoggerFactory.getLogger(NormalizationEngine.class);

    private final Map<IdentityField, List<NormalizationRule>> rulesByField = new EnumMap<>(IdentityField.class);

    public NormalizationEngine(List<NormalizationRule> rules) {
        for (NormalizationRule rule : rules) {
            rulesByField.computeIfAbsent(rule.field(), f -> new ArrayList<>()).add(rule);
        }
        rulesByField.replaceAll((field, fieldRules) -> List.copyOf(fieldRules));
    }

    /**
     * Normalizes a value for the given field. Null or blank input yields the empty string.
     */
    public String normalize(String value, IdentityField field) {
        if (value == null || value.isBlank()) {
            return "";
        }

        String result = value;
        for (NormalizationRule rule : rulesByField.getOrDefault(field, List.of())) {
            String before = result;
            result = rule.apply(result);
            if (log.isTraceEnabled() && !before.equals(result)) {
                log.trace("Rule '{}' transformed '{}' -> '{}'", rule.name(), before, result);
            }
        }

        return result.toLowerCase(Locale.ROOT)
                .trim()
                .replaceAll("\\s+", " ");
    }

    /**
     * Full name as compared by the scorer: first and last name joined, then normalized.
     */
    public String normalizeFullName(String firstName, String lastName) {
        String first = firstName != null ? firstName : "";
        String last = lastName != null ? lastName : "";
        return normalize(first + " " + last, IdentityField.NAME);
    }
}
