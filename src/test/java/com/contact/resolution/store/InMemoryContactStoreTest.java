package com.contact.resolution.store;

import com.contact.resolution.core.model.Contact;
import com.contact.resolution.core.model.ContactOwnedRecord;
import com.contact.resolution.core.model.Message;
import com.contact.resolution.core.model.MessageChannel;
import com.contact.resolution.core.model.MessageDirection;
import com.contact.resolution.core.model.Note;
import com.contact.resolution.core.model.RecordType;
import com.contact.resolution.core.model.RelationshipCounts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryContactStoreTest {

    private InMemoryContactStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryContactStore();
    }

    @Nested
    @DisplayName("Contacts")
    class ContactTests {

        @Test
        @DisplayName("New contact is stored at version 1")
        void testCreate() {
            Contact saved = store.save(Contact.builder().firstName("Ann").build());

            assertEquals(1, saved.getVersion());
            assertEquals(saved, store.findById(saved.getId()).orElseThrow());
        }

        @Test
        @DisplayName("Update with the current version bumps it")
        void testUpdate() {
            Contact saved = store.save(Contact.builder().firstName("Ann").build());

            Contact updated = store.save(Contact.builder(saved).lastName("Lee").build());

            assertEquals(2, updated.getVersion());
            assertEquals("Lee", store.findById(saved.getId()).orElseThrow().getLastName());
        }

        @Test
        @DisplayName("Update with an old version is rejected")
        void testStaleUpdate() {
            Contact saved = store.save(Contact.builder().firstName("Ann").build());
            store.save(Contact.builder(saved).lastName("Lee").build());

            StaleContactException e = assertThrows(StaleContactException.class,
                    () -> store.save(Contact.builder(saved).lastName("Other").build()));
            assertEquals(saved.getId(), e.getContactId());
        }

        @Test
        @DisplayName("findByIds skips missing ids")
        void testFindByIds() {
            Contact a = store.save(Contact.builder().firstName("A").build());

            assertEquals(List.of(a), store.findByIds(List.of("nope", a.getId())));
        }
    }

    @Nested
    @DisplayName("Blocking index")
    class IndexTests {

        @Test
        @DisplayName("Contacts are found by their email key")
        void testLookupByKey() {
            Contact a = store.save(Contact.builder().email("a@example.com").build());
            store.save(Contact.builder().email("b@example.com").build());

            assertEquals(Set.of(a.getId()), store.findIdsByBlockingKeys(Set.of("email:a@example.com"), 0));
        }

        @Test
        @DisplayName("Limit caps the number of ids returned")
        void testLimit() {
            for (int i = 0; i < 5; i++) {
                store.save(Contact.builder().firstName("John").lastName("Smith").build());
            }

            assertEquals(5, store.findIdsByBlockingKeys(Set.of("nt:smith"), 0).size());
            assertEquals(2, store.findIdsByBlockingKeys(Set.of("nt:smith"), 2).size());
        }

        @Test
        @DisplayName("Index follows updates and deletes")
        void testReindex() {
            Contact a = store.save(Contact.builder().email("old@example.com").build());
            Contact updated = store.save(Contact.builder(a).email("new@example.com").build());

            assertTrue(store.findIdsByBlockingKeys(Set.of("email:old@example.com"), 0).isEmpty());
            assertEquals(Set.of(a.getId()), store.findIdsByBlockingKeys(Set.of("email:new@example.com"), 0));

            store.inTransaction(tx -> {
                tx.delete(a.getId(), updated.getVersion());
                return null;
            });
            assertTrue(store.findIdsByBlockingKeys(Set.of("email:new@example.com"), 0).isEmpty());
        }
    }

    @Nested
    @DisplayName("Owned records")
    class RecordTests {

        @Test
        @DisplayName("Record for a missing contact is rejected")
        void testOrphanRejected() {
            assertThrows(StoreException.class, () -> store.saveRecord(Note.of("missing", "u", "text")));
        }

        @Test
        @DisplayName("Records are counted and listed per type")
        void testCountsAndListing() {
            Contact a = store.save(Contact.builder().firstName("A").build());
            store.saveRecord(Message.of(a.getId(), MessageChannel.SMS, MessageDirection.OUTBOUND, "hi"));
            store.saveRecord(Message.of(a.getId(), MessageChannel.SMS, MessageDirection.INBOUND, "hey"));
            store.saveRecord(Note.of(a.getId(), "u", "called"));

            assertEquals(2, store.countRelationships(a.getId()).messages());
            assertEquals(1, store.countRelationships(a.getId()).notes());
            List<ContactOwnedRecord> messages = store.findRecords(a.getId(), RecordType.MESSAGE);
            assertEquals(2, messages.size());
            assertTrue(messages.stream().allMatch(r -> r instanceof Message));
        }
    }

    @Nested
    @DisplayName("Transactions")
    class TransactionTests {

        @Test
        @DisplayName("Writes are invisible until commit")
        void testBufferedWrites() {
            Contact a = store.save(Contact.builder().firstName("A").build());
            Contact b = store.save(Contact.builder().firstName("B").build());
            store.saveRecord(Note.of(b.getId(), "u", "x"));

            store.inTransaction(tx -> {
                tx.reassignRecords(RecordType.NOTE, b.getId(), a.getId());
                assertEquals(1, store.countRelationships(b.getId()).notes());
                tx.update(Contact.builder(a).lastName("Merged").build());
                tx.delete(b.getId(), b.getVersion());
                assertTrue(store.findById(b.getId()).isPresent());
                assertTrue(tx.findById(b.getId()).isEmpty());
                return null;
            });

            assertTrue(store.findById(b.getId()).isEmpty());
            assertEquals("Merged", store.findById(a.getId()).orElseThrow().getLastName());
            assertEquals(1, store.countRelationships(a.getId()).notes());
        }

        @Test
        @DisplayName("Reassigned counts are taken at commit")
        void testCountsTakenAtCommit() {
            Contact a = store.save(Contact.builder().firstName("A").build());
            Contact b = store.save(Contact.builder().firstName("B").build());
            store.saveRecord(Note.of(b.getId(), "u", "x"));

            StoreTransaction committed = store.inTransaction(tx -> {
                tx.reassignRecords(RecordType.NOTE, b.getId(), a.getId());
                store.saveRecord(Note.of(b.getId(), "u", "late"));
                assertEquals(RelationshipCounts.empty(), tx.reassigned());
                return tx;
            });

            assertEquals(2, committed.reassigned().notes());
            assertEquals(2, store.countRelationships(a.getId()).notes());
            assertEquals(0, store.countRelationships(b.getId()).notes());
        }

        @Test
        @DisplayName("Callback failure applies nothing")
        void testCallbackFailure() {
            Contact a = store.save(Contact.builder().firstName("A").build());
            Contact b = store.save(Contact.builder().firstName("B").build());

            assertThrows(IllegalStateException.class, () -> store.inTransaction(tx -> {
                tx.delete(b.getId(), b.getVersion());
                tx.update(Contact.builder(a).lastName("X").build());
                throw new IllegalStateException("boom");
            }));

            assertTrue(store.findById(b.getId()).isPresent());
            assertEquals(1, store.findById(a.getId()).orElseThrow().getVersion());
        }

        @Test
        @DisplayName("Failed version guard applies nothing")
        void testGuardFailure() {
            Contact a = store.save(Contact.builder().firstName("A").build());
            Contact b = store.save(Contact.builder().firstName("B").build());
            store.saveRecord(Note.of(b.getId(), "u", "x"));

            StaleContactException e = assertThrows(StaleContactException.class, () -> store.inTransaction(tx -> {
                tx.reassignRecords(RecordType.NOTE, b.getId(), a.getId());
                tx.update(Contact.builder(a).lastName("X").build());
                tx.delete(b.getId(), b.getVersion());
                store.save(Contact.builder(b).lastName("Changed").build());
                return null;
            }));

            assertEquals(b.getId(), e.getContactId());
            assertNull(store.findById(a.getId()).orElseThrow().getLastName());
            assertEquals(1, store.countRelationships(b.getId()).notes());
        }
    }
}
