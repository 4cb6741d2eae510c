package com.contact.resolution.cache;

import com.contact.resolution.core.model.DuplicateCandidate;

import java.util.List;
import java.util.Optional;

/**
 * Used when caching is disabled.
 */
public class NoOpCandidateCache implements CandidateCache {

    @Override
    public Optional<List<DuplicateCandidate>> get(String searchKey) {
        return Optional.empty();
    }

    @Override
    public void put(String searchKey, List<DuplicateCandidate> candidates) {
        // no-op
    }

    @Override
    public void invalidate(String contactId) {
        // no-op
    }

    @Override
    public void invalidateAll() {
        // no-op
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
