package com.contact.resolution.cache;

import com.contact.resolution.core.model.DuplicateCandidate;

import java.util.List;
import java.util.Optional;

/**
 * Cache of duplicate search results keyed by the normalized search tuple.
 */
public interface CandidateCache {

    Optional<List<DuplicateCandidate>> get(String searchKey);

    void put(String searchKey, List<DuplicateCandidate> candidates);

    /**
     * Drops every cached result that lists the given contact.
     */
    void invalidate(String contactId);

    void invalidateAll();

    CacheStats getStats();
}
