package com.contact.resolution.cache;

import com.contact.resolution.core.model.DuplicateCandidate;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Caffeine-backed search cache with a contact id index for targeted invalidation.
 * Registered as a {@link MergeListener} so both sides of a merge drop out of cached results.
 */
public class CaffeineCandidateCache implements CandidateCache, MergeListener {
    private static final Logger log = LoggerFactory.getLogger(CaffeineCandidateCache.class);

    private final Cache<String, List<DuplicateCandidate>> cache;
    // contactId -> search keys whose cached result lists that contact
    private final ConcurrentMap<String, Set<String>> contactIndex = new ConcurrentHashMap<>();

    public CaffeineCandidateCache(CacheConfig config) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .recordStats()
                .executor(Runnable::run)
                .removalListener((String key, List<DuplicateCandidate> value, RemovalCause cause) -> {
                    if (key != null && value != null) {
                        unindex(key, value);
                    }
                })
                .build();
        log.info("CaffeineCandidateCache initialized: maxSize={}, ttl={}s", config.maxSize(), config.ttlSeconds());
    }

    @Override
    public Optional<List<DuplicateCandidate>> get(String searchKey) {
        return Optional.ofNullable(cache.getIfPresent(searchKey));
    }

    @Override
    public void put(String searchKey, List<DuplicateCandidate> candidates) {
        List<DuplicateCandidate> copy = List.copyOf(candidates);
        cache.put(searchKey, copy);
        for (DuplicateCandidate candidate : copy) {
            contactIndex.compute(candidate.contactId(), (id, keys) -> {
                Set<String> indexed = keys != null ? keys : ConcurrentHashMap.newKeySet();
                indexed.add(searchKey);
                return indexed;
            });
        }
    }

    @Override
    public void invalidate(String contactId) {
        Set<String> keys = contactIndex.remove(contactId);
        if (keys != null) {
            keys.forEach(cache::invalidate);
            log.debug("cache.invalidated contactId={} entries={}", contactId, keys.size());
        }
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        contactIndex.clear();
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats stats = cache.stats();
        return new CacheStats(stats.hitCount(), stats.missCount(), stats.evictionCount(), cache.estimatedSize());
    }

    @Override
    public void onMerge(String primaryContactId, String secondaryContactId) {
        invalidate(primaryContactId);
        invalidate(secondaryContactId);
    }

    /**
     * Number of contact ids that currently point at a cached search.
     */
    int indexedContacts() {
        return contactIndex.size();
    }

    private void unindex(String searchKey, List<DuplicateCandidate> removed) {
        // a replaced entry may still list some of the same contacts
        List<DuplicateCandidate> current = cache.asMap().get(searchKey);
        for (DuplicateCandidate candidate : removed) {
            if (current != null && current.stream().anyMatch(c -> c.contactId().equals(candidate.contactId()))) {
                continue;
            }
            contactIndex.computeIfPresent(candidate.contactId(), (id, keys) -> {
                keys.remove(searchKey);
                return keys.isEmpty() ? null : keys;
            });
        }
    }
}
