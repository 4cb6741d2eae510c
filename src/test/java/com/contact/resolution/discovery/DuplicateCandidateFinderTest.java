package com.contact.resolution.discovery;

import com.contact.resolution.cache.CacheConfig;
import com.contact.resolution.cache.CaffeineCandidateCache;
import com.contact.resolution.core.exception.ErrorKind;
import com.contact.resolution.core.exception.ValidationException;
import com.contact.resolution.core.model.Contact;
import com.contact.resolution.core.model.DuplicateCandidate;
import com.contact.resolution.core.model.IdentityTuple;
import com.contact.resolution.core.model.MatchReason;
import com.contact.resolution.metrics.NoOpMetricsService;
import com.contact.resolution.similarity.ContactSimilarityScorer;
import com.contact.resolution.similarity.DefaultBlockingKeyStrategy;
import com.contact.resolution.store.ContactStore;
import com.contact.resolution.store.InMemoryContactStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anySet;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class DuplicateCandidateFinderTest {

    private InMemoryContactStore store;
    private DuplicateCandidateFinder finder;

    @BeforeEach
    void setUp() {
        store = new InMemoryContactStore();
        finder = new DuplicateCandidateFinder(store, new ContactSimilarityScorer(), new DefaultBlockingKeyStrategy());
    }

    private Contact save(String first, String last, String email, String phone) {
        return store.save(Contact.builder()
                .firstName(first)
                .lastName(last)
                .email(email)
                .phone(phone)
                .build());
    }

    @Nested
    @DisplayName("Matching")
    class MatchingTests {

        @Test
        @DisplayName("Finds a contact sharing the email")
        void testEmailMatch() {
            Contact existing = save("Alice", "Brown", "alice@example.com", null);
            save("Bob", "Stone", "bob@example.com", null);

            List<DuplicateCandidate> candidates = finder.findDuplicates(
                    IdentityTuple.of("Alicia", "Brown", "ALICE@example.com", null));

            assertEquals(1, candidates.size());
            DuplicateCandidate candidate = candidates.get(0);
            assertEquals(existing.getId(), candidate.contactId());
            assertTrue(candidate.similarity() >= 0.9);
            assertTrue(candidate.matchReasons().contains(MatchReason.EXACT_EMAIL));
        }

        @Test
        @DisplayName("Finds a contact sharing the phone in another format")
        void testPhoneMatch() {
            Contact existing = save("Carl", "Diaz", null, "+1 415 555 0100");

            List<DuplicateCandidate> candidates = finder.findDuplicates(
                    IdentityTuple.of(null, null, null, "(415) 555-0100"));

            assertEquals(List.of(existing.getId()), candidates.stream().map(DuplicateCandidate::contactId).toList());
        }

        @Test
        @DisplayName("A similar name alone is not a duplicate")
        void testFuzzyNameOnly() {
            save("John", "Smith", "john@example.com", null);

            assertTrue(finder.findDuplicates(IdentityTuple.of("Jon", "Smith", null, null)).isEmpty());
        }

        @Test
        @DisplayName("Nothing in common yields no candidates")
        void testNoMatch() {
            save("Alice", "Brown", "alice@example.com", "+14155550100");

            assertTrue(finder.findDuplicates(IdentityTuple.of("Zed", "Quinn", "zed@example.org", null)).isEmpty());
        }

        @Test
        @DisplayName("The excluded contact never appears in its own results")
        void testExclusion() {
            Contact self = save("Alice", "Brown", "alice@example.com", null);
            Contact other = save("Alice", "B", "alice@example.com", null);

            List<DuplicateCandidate> candidates = finder.findDuplicates(self.identity(), self.getId());

            assertEquals(List.of(other.getId()), candidates.stream().map(DuplicateCandidate::contactId).toList());
        }
    }

    @Nested
    @DisplayName("Ordering")
    class OrderingTests {

        @Test
        @DisplayName("Higher similarity ranks first")
        void testSimilarityFirst() {
            Contact emailOnly = save("Zoe", "Ray", "sam@example.com", null);
            Contact emailAndPhone = save("Sam", "Hill", "sam@example.com", "+14155550100");

            List<DuplicateCandidate> candidates = finder.findDuplicates(
                    IdentityTuple.of(null, null, "sam@example.com", "+14155550100"));

            assertEquals(List.of(emailAndPhone.getId(), emailOnly.getId()),
                    candidates.stream().map(DuplicateCandidate::contactId).toList());
        }

        @Test
        @DisplayName("Ties break by most recent contact, then oldest creation")
        void testTieBreaks() {
            Instant now = Instant.parse("2024-05-01T10:00:00Z");
            Contact older = store.save(Contact.builder().email("x@example.com")
                    .createdAt(now.minusSeconds(3600)).build());
            Contact newer = store.save(Contact.builder().email("x@example.com")
                    .createdAt(now).build());
            Contact recent = store.save(Contact.builder().email("x@example.com")
                    .createdAt(now).lastContactedAt(now).build());

            List<DuplicateCandidate> candidates = finder.findDuplicates(
                    IdentityTuple.of(null, null, "x@example.com", null));

            assertEquals(List.of(recent.getId(), older.getId(), newer.getId()),
                    candidates.stream().map(DuplicateCandidate::contactId).toList());
        }
    }

    @Nested
    @DisplayName("Validation")
    class ValidationTests {

        @Test
        @DisplayName("Tuple without name, email or phone is rejected")
        void testNoIdentifyingField() {
            ValidationException e = assertThrows(ValidationException.class, () ->
                    finder.findDuplicates(new IdentityTuple(null, " ", "", null, "Acme")));
            assertEquals(ErrorKind.VALIDATION_ERROR, e.getKind());
        }

        @Test
        @DisplayName("Null tuple is rejected")
        void testNullTuple() {
            assertThrows(ValidationException.class, () -> finder.findDuplicates(null));
        }

        @Test
        @DisplayName("Non-positive fuzzy limit is rejected")
        void testInvalidLimit() {
            assertThrows(IllegalArgumentException.class, () -> new DuplicateCandidateFinder(store,
                    new ContactSimilarityScorer(), new DefaultBlockingKeyStrategy(), null, null, 0));
        }
    }

    @Nested
    @DisplayName("Pre-filter")
    class PreFilterTests {

        @Test
        @DisplayName("Exact keys are unbounded, fuzzy keys are capped")
        void testLimits() {
            ContactStore mockStore = mock(ContactStore.class);
            when(mockStore.findIdsByBlockingKeys(anySet(), anyInt())).thenReturn(Set.of());
            when(mockStore.findByIds(anyCollection())).thenReturn(List.of());

            DuplicateCandidateFinder limited = new DuplicateCandidateFinder(mockStore, new ContactSimilarityScorer(),
                    new DefaultBlockingKeyStrategy(), null, new NoOpMetricsService(), 25);
            limited.findDuplicates(IdentityTuple.of("John", "Smith", "john@example.com", null));

            verify(mockStore).findIdsByBlockingKeys(eq(Set.of("email:john@example.com")), eq(0));
            verify(mockStore).findIdsByBlockingKeys(argThat(keys -> keys.contains("nt:smith")), eq(25));
        }

        @Test
        @DisplayName("Contacts outside every blocking key are never loaded")
        void testUnrelatedNotLoaded() {
            ContactStore mockStore = mock(ContactStore.class);
            when(mockStore.findIdsByBlockingKeys(anySet(), anyInt())).thenReturn(Set.of());
            when(mockStore.findByIds(anyCollection())).thenReturn(List.of());

            new DuplicateCandidateFinder(mockStore, new ContactSimilarityScorer(), new DefaultBlockingKeyStrategy())
                    .findDuplicates(IdentityTuple.of(null, null, "a@example.com", null));

            verify(mockStore).findByIds(argThat(ids -> ids.isEmpty()));
        }
    }

    @Nested
    @DisplayName("Caching")
    class CachingTests {

        @Test
        @DisplayName("Repeated search is served from cache until a merge touches a candidate")
        void testCacheInvalidatedOnMerge() {
            CaffeineCandidateCache cache = new CaffeineCandidateCache(CacheConfig.defaults());
            DuplicateCandidateFinder cached = new DuplicateCandidateFinder(store, new ContactSimilarityScorer(),
                    new DefaultBlockingKeyStrategy(), cache, new NoOpMetricsService(), 500);
            Contact existing = save("Alice", "Brown", "alice@example.com", null);
            IdentityTuple query = IdentityTuple.of(null, null, "alice@example.com", null);

            cached.findDuplicates(query);
            cached.findDuplicates(query);
            assertEquals(1, cache.getStats().hitCount());

            cache.onMerge("someone-else", existing.getId());
            cached.findDuplicates(query);
            assertEquals(1, cache.getStats().hitCount());
        }
    }
}
