package com.contact.resolution.similarity;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Index keys derived from one identity.
 * Exact keys identify a contact by email or phone; fuzzy keys group similar names.
 */
public record BlockingKeys(Set<String> exactKeys, Set<String> fuzzyKeys) {

    public BlockingKeys {
        exactKeys = exactKeys != null ? Set.copyOf(exactKeys) : Set.of();
        fuzzyKeys = fuzzyKeys != null ? Set.copyOf(fuzzyKeys) : Set.of();
    }

    public static BlockingKeys none() {
        return new BlockingKeys(Set.of(), Set.of());
    }

    public Set<String> all() {
        Set<String> all = new LinkedHashSet<>(exactKeys);
        all.addAll(fuzzyKeys);
        return all;
    }

    public boolean isEmpty() {
        return exactKeys.isEmpty() && fuzzyKeys.isEmpty();
    }
}
