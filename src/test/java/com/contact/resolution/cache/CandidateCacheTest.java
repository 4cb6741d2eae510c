package com.contact.resolution.cache;

import com.contact.resolution.core.model.DuplicateCandidate;
import com.contact.resolution.core.model.MatchReason;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CandidateCacheTest {

    private static DuplicateCandidate candidate(String contactId) {
        return new DuplicateCandidate(contactId, "John", "Smith", null, null, null, null, null,
                0.7, List.of(MatchReason.FUZZY_NAME));
    }

    @Nested
    @DisplayName("CaffeineCandidateCache")
    class CaffeineTests {

        private CaffeineCandidateCache cache;

        @BeforeEach
        void setUp() {
            cache = new CaffeineCandidateCache(CacheConfig.defaults());
        }

        @Test
        @DisplayName("Should return cached result and track hits and misses")
        void testGetPut() {
            assertTrue(cache.get("search-1").isEmpty());

            cache.put("search-1", List.of(candidate("c1")));

            assertEquals("c1", cache.get("search-1").orElseThrow().get(0).contactId());
            CacheStats stats = cache.getStats();
            assertEquals(1, stats.hitCount());
            assertEquals(1, stats.missCount());
            assertEquals(0.5, stats.hitRate(), 0.0001);
        }

        @Test
        @DisplayName("Index forgets contacts whose searches are all gone")
        void testIndexShrinks() {
            cache.put("search-1", List.of(candidate("c1"), candidate("c2")));
            cache.put("search-2", List.of(candidate("c2")));

            cache.invalidate("c1");
            assertEquals(1, cache.indexedContacts());

            cache.invalidate("c2");
            assertEquals(0, cache.indexedContacts());
        }

        @Test
        @DisplayName("Replacing a search re-points the index to the new result")
        void testReplacedEntry() {
            cache.put("search-1", List.of(candidate("c1"), candidate("c2")));
            cache.put("search-1", List.of(candidate("c2"), candidate("c3")));

            assertEquals(2, cache.indexedContacts());
            cache.invalidate("c1");
            assertTrue(cache.get("search-1").isPresent());

            cache.invalidate("c3");
            assertTrue(cache.get("search-1").isEmpty());
            assertEquals(0, cache.indexedContacts());
        }

        @Test
        @DisplayName("Invalidating a contact drops every search that listed it")
        void testInvalidateContact() {
            cache.put("search-1", List.of(candidate("c1"), candidate("c2")));
            cache.put("search-2", List.of(candidate("c2")));
            cache.put("search-3", List.of(candidate("c3")));

            cache.invalidate("c2");

            assertTrue(cache.get("search-1").isEmpty());
            assertTrue(cache.get("search-2").isEmpty());
            assertTrue(cache.get("search-3").isPresent());
        }

        @Test
        @DisplayName("Merge invalidates both sides")
        void testOnMerge() {
            cache.put("search-1", List.of(candidate("primary")));
            cache.put("search-2", List.of(candidate("secondary")));
            cache.put("search-3", List.of(candidate("other")));

            cache.onMerge("primary", "secondary");

            assertTrue(cache.get("search-1").isEmpty());
            assertTrue(cache.get("search-2").isEmpty());
            assertTrue(cache.get("search-3").isPresent());
        }

        @Test
        @DisplayName("Empty results are cached too")
        void testEmptyResult() {
            cache.put("search-1", List.of());
            assertEquals(List.of(), cache.get("search-1").orElseThrow());
        }

        @Test
        @DisplayName("invalidateAll clears everything")
        void testInvalidateAll() {
            cache.put("search-1", List.of(candidate("c1")));
            cache.invalidateAll();
            assertTrue(cache.get("search-1").isEmpty());
        }
    }

    @Nested
    @DisplayName("NoOpCandidateCache")
    class NoOpTests {

        @Test
        @DisplayName("Never returns a cached result")
        void testNoOp() {
            NoOpCandidateCache cache = new NoOpCandidateCache();
            cache.put("search-1", List.of(candidate("c1")));
            assertTrue(cache.get("search-1").isEmpty());
            assertEquals(0, cache.getStats().hitCount());
        }
    }

    @Nested
    @DisplayName("CacheConfig")
    class ConfigTests {

        @Test
        @DisplayName("Rejects non-positive sizes and TTLs")
        void testValidation() {
            assertThrows(IllegalArgumentException.class, () -> new CacheConfig(0, 30, true));
            assertThrows(IllegalArgumentException.class, () -> new CacheConfig(10, 0, true));
        }

        @Test
        @DisplayName("Presets")
        void testPresets() {
            assertTrue(CacheConfig.defaults().enabled());
            assertEquals(30, CacheConfig.defaults().ttlSeconds());
            assertFalse(CacheConfig.disabled().enabled());
        }
    }
}
