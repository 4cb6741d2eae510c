package com.contact.resolution.api;

import com.contact.resolution.audit.AuditAction;
import com.contact.resolution.cache.CacheConfig;
import com.contact.resolution.core.exception.ContactNotFoundException;
import com.contact.resolution.core.exception.ValidationException;
import com.contact.resolution.core.model.Contact;
import com.contact.resolution.core.model.DuplicateCandidate;
import com.contact.resolution.core.model.IdentityTuple;
import com.contact.resolution.core.model.Message;
import com.contact.resolution.core.model.MessageChannel;
import com.contact.resolution.core.model.MessageDirection;
import com.contact.resolution.core.model.Note;
import com.contact.resolution.core.model.RelationshipCounts;
import com.contact.resolution.merge.BatchMergeResult;
import com.contact.resolution.merge.MergeResult;
import com.contact.resolution.store.InMemoryContactStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ContactResolverTest {

    private ContactResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = ContactResolver.builder()
                .cacheConfig(CacheConfig.defaults())
                .build();
    }

    @AfterEach
    void tearDown() {
        resolver.close();
    }

    private Contact create(String first, String last, String email, String phone) {
        return resolver.createContact(Contact.builder()
                .firstName(first).lastName(last).email(email).phone(phone).build());
    }

    @Nested
    @DisplayName("Contacts")
    class ContactTests {

        @Test
        @DisplayName("Phone numbers are stored in E.164")
        void testPhoneNormalization() {
            Contact created = resolver.createContact(Contact.builder()
                    .firstName("Ann").phone("(415) 555-0100").whatsapp("  ").build());

            assertEquals("+14155550100", created.getPhone());
            assertNull(created.getWhatsapp());
            assertEquals(1, created.getVersion());
        }

        @Test
        @DisplayName("Blank or unknown ids give an empty lookup")
        void testGetContact() {
            assertTrue(resolver.getContact(" ").isEmpty());
            assertTrue(resolver.getContact("missing").isEmpty());
        }

        @Test
        @DisplayName("Records are attached to an existing contact only")
        void testAddRecord() {
            Contact ann = create("Ann", "Lee", "ann@example.com", null);

            resolver.addRecord(Note.of(ann.getId(), "user-1", "first call"));
            resolver.addRecord(Message.of(ann.getId(), MessageChannel.EMAIL, MessageDirection.OUTBOUND, "hello"));

            assertEquals(new RelationshipCounts(1, 1, 0, 0), resolver.getRelationshipCounts(ann.getId()));
            assertThrows(ContactNotFoundException.class,
                    () -> resolver.addRecord(Note.of("missing", "user-1", "x")));
        }

        @Test
        @DisplayName("Counts for a missing contact are not found")
        void testCountsNotFound() {
            assertThrows(ContactNotFoundException.class, () -> resolver.getRelationshipCounts("missing"));
            assertThrows(ValidationException.class, () -> resolver.getRelationshipCounts(""));
        }
    }

    @Nested
    @DisplayName("Duplicate discovery")
    class DiscoveryTests {

        @Test
        @DisplayName("Finds a contact sharing the email")
        void testFindByEmail() {
            Contact ann = create("Ann", "Lee", "ann@example.com", null);
            create("Bob", "Stone", "bob@example.com", null);

            List<DuplicateCandidate> found = resolver.findDuplicates(
                    IdentityTuple.of("Annie", "Lee", "ANN@example.com", null));

            assertEquals(1, found.size());
            assertEquals(ann.getId(), found.get(0).contactId());
        }

        @Test
        @DisplayName("Duplicates of a contact exclude the contact itself")
        void testFindDuplicatesOf() {
            Contact first = create("John", "Smith", "john@example.com", null);
            Contact second = create("Jon", "Smith", "John@Example.com", null);

            List<DuplicateCandidate> found = resolver.findDuplicatesOf(first.getId());

            assertEquals(List.of(second.getId()), found.stream().map(DuplicateCandidate::contactId).toList());
            assertThrows(ContactNotFoundException.class, () -> resolver.findDuplicatesOf("missing"));
        }

        @Test
        @DisplayName("Repeated searches hit the cache until a contact is created")
        void testCaching() {
            create("Ann", "Lee", "ann@example.com", null);
            IdentityTuple query = IdentityTuple.of(null, null, null, "+14155550100");

            assertTrue(resolver.findDuplicates(query).isEmpty());
            assertTrue(resolver.findDuplicates(query).isEmpty());
            assertEquals(1, resolver.getCacheStats().hitCount());

            create("Bob", "Stone", null, "415-555-0100");
            assertEquals(1, resolver.findDuplicates(query).size());
        }
    }

    @Nested
    @DisplayName("Merging")
    class MergeTests {

        @Test
        @DisplayName("Merge moves records and drops the secondary from later searches")
        void testMerge() {
            Contact primary = create("Ann", "Lee", "ann@example.com", null);
            Contact secondary = create("Anne", "Lee", "ann@example.com", "+14155550100");
            resolver.addRecord(Note.of(secondary.getId(), "user-1", "met at conference"));
            IdentityTuple query = IdentityTuple.of(null, null, "ann@example.com", null);
            assertEquals(2, resolver.findDuplicates(query).size());

            MergeResult result = resolver.mergeContacts(primary.getId(), secondary.getId());

            assertEquals("+14155550100", result.primary().getPhone());
            assertEquals(1, result.counts().notes());
            assertTrue(resolver.getContact(secondary.getId()).isEmpty());
            assertEquals(List.of(primary.getId()),
                    resolver.findDuplicates(query).stream().map(DuplicateCandidate::contactId).toList());
            assertEquals(1, resolver.getMergeHistory(primary.getId()).size());
            assertEquals("system", resolver.getMergeHistory(primary.getId()).get(0).triggeredBy());
            assertEquals(1, resolver.getAuditService().getEntriesByAction(AuditAction.CONTACT_MERGED).size());
        }

        @Test
        @DisplayName("Batch merge folds every duplicate into the primary")
        void testBatch() {
            Contact primary = create("Ann", "Lee", "ann@example.com", null);
            Contact a = create("Ann", "Lee", null, "+14155550100");
            Contact b = create("A.", "Lee", "ann@example.com", null);
            resolver.addRecord(Note.of(a.getId(), "u", "x"));
            resolver.addRecord(Note.of(b.getId(), "u", "y"));

            BatchMergeResult result = resolver.mergeBatch(primary.getId(), List.of(a.getId(), b.getId()), null, "user-7");

            assertTrue(result.isComplete());
            assertEquals(2, result.mergedCount());
            assertEquals(2, result.counts().notes());
            assertEquals("user-7", resolver.getMergeLedger().getRecordsForSecondary(b.getId()).get(0).triggeredBy());
        }
    }

    @Test
    @DisplayName("An explicit store is used as given")
    void testExplicitStore() {
        InMemoryContactStore store = new InMemoryContactStore();
        try (ContactResolver custom = ContactResolver.builder()
                .store(store)
                .options(DeduplicationOptions.strict())
                .build()) {
            custom.createContact(Contact.builder().firstName("Ann").build());

            assertSame(store, custom.getStore());
            assertEquals(1, store.size());
            assertEquals(DeduplicationOptions.strict().getDuplicateThreshold(),
                    custom.getOptions().getDuplicateThreshold());
        }
    }
}
