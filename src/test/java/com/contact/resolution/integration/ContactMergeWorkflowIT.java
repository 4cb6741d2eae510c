package com.contact.resolution.integration;

import com.contact.resolution.api.ContactResolver;
import com.contact.resolution.core.exception.ContactNotFoundException;
import com.contact.resolution.core.model.Contact;
import com.contact.resolution.core.model.CustomFieldKey;
import com.contact.resolution.core.model.CustomFields;
import com.contact.resolution.core.model.DuplicateCandidate;
import com.contact.resolution.core.model.IdentityTuple;
import com.contact.resolution.core.model.MatchReason;
import com.contact.resolution.core.model.Message;
import com.contact.resolution.core.model.MessageChannel;
import com.contact.resolution.core.model.MessageDirection;
import com.contact.resolution.core.model.Note;
import com.contact.resolution.core.model.RecordType;
import com.contact.resolution.core.model.RelationshipCounts;
import com.contact.resolution.merge.BatchMergeResult;
import com.contact.resolution.merge.MergeResult;
import com.contact.resolution.store.StaleContactException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Duplicate discovery and merging against a real FalkorDB graph.
 */
class ContactMergeWorkflowIT extends AbstractFalkorDBIntegrationTest {

    private ContactResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = createResolver("merge-workflow");
    }

    @AfterEach
    void tearDown() {
        resolver.close();
    }

    @Test
    @DisplayName("Contact properties survive storage")
    void testContactRoundTrip() {
        Contact created = resolver.createContact(Contact.builder()
                .firstName("O'Brien")
                .lastName("Lee")
                .email("ann@example.com")
                .phone("(415) 555-0100")
                .tags(List.of("vip", "newsletter"))
                .customFields(CustomFields.builder()
                        .put(CustomFieldKey.SOURCE, "import")
                        .put(CustomFieldKey.SYNCED_FROM_HUBSPOT, true)
                        .build())
                .build());

        Contact loaded = resolver.getContact(created.getId()).orElseThrow();

        assertEquals("O'Brien", loaded.getFirstName());
        assertEquals("+14155550100", loaded.getPhone());
        assertEquals(Set.of("vip", "newsletter"), loaded.getTags());
        assertEquals("import", loaded.getCustomFields().getString(CustomFieldKey.SOURCE).orElseThrow());
        assertEquals(1, loaded.getVersion());
    }

    @Test
    @DisplayName("Duplicates are found through email and fuzzy name")
    void testFindDuplicates() {
        Contact byEmail = resolver.createContact(Contact.builder()
                .firstName("Ann").lastName("Lee").email("ann@example.com").build());
        resolver.createContact(Contact.builder().firstName("Bob").lastName("Stone").build());

        List<DuplicateCandidate> found = resolver.findDuplicates(
                IdentityTuple.of("Anne", "Lee", "ANN@example.com", null));

        assertEquals(1, found.size());
        assertEquals(byEmail.getId(), found.get(0).contactId());
        assertTrue(found.get(0).matchReasons().contains(MatchReason.EXACT_EMAIL));
    }

    @Test
    @DisplayName("Merge moves every owned record and deletes the secondary")
    void testMerge() {
        Contact primary = resolver.createContact(Contact.builder()
                .firstName("Ann").lastName("Lee").email("ann@example.com").tag("vip").build());
        Contact secondary = resolver.createContact(Contact.builder()
                .firstName("Anne").lastName("Lee").phone("+14155550100").jobTitle("CTO").tag("lead").build());
        resolver.addRecord(Message.of(primary.getId(), MessageChannel.SMS, MessageDirection.OUTBOUND, "hi"));
        resolver.addRecord(Message.of(secondary.getId(), MessageChannel.SMS, MessageDirection.INBOUND, "hey"));
        resolver.addRecord(Note.of(secondary.getId(), "user-1", "met at conference"));

        MergeResult result = resolver.mergeContacts(primary.getId(), secondary.getId());

        assertEquals(new RelationshipCounts(2, 1, 0, 0), result.counts());
        assertEquals(new RelationshipCounts(1, 1, 0, 0), result.migrated());
        Contact merged = resolver.getContact(primary.getId()).orElseThrow();
        assertEquals("Ann", merged.getFirstName());
        assertEquals("+14155550100", merged.getPhone());
        assertEquals("CTO", merged.getJobTitle());
        assertEquals(Set.of("vip", "lead"), merged.getTags());
        assertEquals(2, merged.getVersion());
        assertTrue(resolver.getContact(secondary.getId()).isEmpty());
        assertEquals(RelationshipCounts.empty(), resolver.getStore().countRelationships(secondary.getId()));
        assertEquals(1, resolver.getStore().findRecords(primary.getId(), RecordType.NOTE).size());
    }

    @Test
    @DisplayName("Batch stops at the first missing duplicate")
    void testBatchStopsAtFailure() {
        Contact primary = resolver.createContact(Contact.builder().firstName("Ann").build());
        Contact a = resolver.createContact(Contact.builder().firstName("Ann").lastName("L").build());
        Contact c = resolver.createContact(Contact.builder().firstName("A").lastName("Lee").build());

        BatchMergeResult result = resolver.mergeBatch(primary.getId(), List.of(a.getId(), "missing", c.getId()));

        assertFalse(result.isComplete());
        assertEquals(List.of(a.getId()), result.mergedIds());
        assertEquals("missing", result.failedId());
        assertEquals(List.of(c.getId()), result.notAttempted());
        assertTrue(resolver.getContact(c.getId()).isPresent());
    }

    @Test
    @DisplayName("Version guard rejects a stale update")
    void testStaleUpdate() {
        Contact created = resolver.createContact(Contact.builder().firstName("Ann").build());
        resolver.getStore().save(Contact.builder(created).lastName("Lee").build());

        assertThrows(StaleContactException.class,
                () -> resolver.getStore().save(Contact.builder(created).lastName("Other").build()));
    }

    @Test
    @DisplayName("Record for a missing contact is rejected")
    void testOrphanRecord() {
        assertThrows(ContactNotFoundException.class,
                () -> resolver.addRecord(Note.of("missing", "user-1", "x")));
    }
}
