package com.contact.resolution.store;

import com.contact.resolution.core.model.Contact;
import com.contact.resolution.core.model.ContactOwnedRecord;
import com.contact.resolution.core.model.RecordType;
import com.contact.resolution.core.model.RelationshipCounts;
import com.contact.resolution.similarity.BlockingKeyStrategy;
import com.contact.resolution.similarity.DefaultBlockingKeyStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe in-memory store.
 *
 * <p>Transactions read live state and buffer their writes. At commit the buffered
 * contact versions are checked and all writes applied while holding the commit lock;
 * a transaction that throws before commit leaves no trace.</p>
 */
public class InMemoryContactStore implements ContactStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryContactStore.class);

    private final Map<String, Contact> contacts = new ConcurrentHashMap<>();
    private final Map<String, ContactOwnedRecord> records = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> blockingIndex = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> keysByContact = new ConcurrentHashMap<>();
    private final ReentrantLock commitLock = new ReentrantLock();
    private final BlockingKeyStrategy blockingKeyStrategy;

    public InMemoryContactStore() {
        this(new DefaultBlockingKeyStrategy());
    }

    public InMemoryContactStore(BlockingKeyStrategy blockingKeyStrategy) {
        this.blockingKeyStrategy = Objects.requireNonNull(blockingKeyStrategy, "blockingKeyStrategy is required");
    }

    @Override
    public Optional<Contact> findById(String contactId) {
        return contactId == null ? Optional.empty() : Optional.ofNullable(contacts.get(contactId));
    }

    @Override
    public List<Contact> findByIds(Collection<String> contactIds) {
        List<Contact> found = new ArrayList<>(contactIds.size());
        for (String id : contactIds) {
            Contact contact = contacts.get(id);
            if (contact != null) {
                found.add(contact);
            }
        }
        return found;
    }

    @Override
    public Set<String> findIdsByBlockingKeys(Set<String> keys, int limit) {
        Set<String> ids = new LinkedHashSet<>();
        for (String key : keys) {
            Set<String> indexed = blockingIndex.get(key);
            if (indexed == null) {
                continue;
            }
            for (String id : new TreeSet<>(indexed)) {
                if (limit > 0 && ids.size() >= limit) {
                    return ids;
                }
                ids.add(id);
            }
        }
        return ids;
    }

    @Override
    public RelationshipCounts countRelationships(String contactId) {
        Map<RecordType, Long> counts = new EnumMap<>(RecordType.class);
        for (ContactOwnedRecord record : records.values()) {
            if (record.contactId().equals(contactId)) {
                counts.merge(record.recordType(), 1L, Long::sum);
            }
        }
        return RelationshipCounts.of(counts);
    }

    @Override
    public List<ContactOwnedRecord> findRecords(String contactId, RecordType type) {
        return records.values().stream()
                .filter(r -> r.recordType() == type && r.contactId().equals(contactId))
                .sorted(Comparator.comparing(ContactOwnedRecord::createdAt).thenComparing(ContactOwnedRecord::id))
                .toList();
    }

    @Override
    public Contact save(Contact contact) {
        Objects.requireNonNull(contact, "contact is required");
        commitLock.lock();
        try {
            Contact existing = contacts.get(contact.getId());
            if (existing != null && existing.getVersion() != contact.getVersion()) {
                throw new StaleContactException(contact.getId());
            }
            Contact stored = existing == null
                    ? Contact.builder(contact).version(1).build()
                    : nextVersion(contact, Instant.now());
            put(stored);
            log.debug("store.contactSaved contactId={} version={}", stored.getId(), stored.getVersion());
            return stored;
        } finally {
            commitLock.unlock();
        }
    }

    @Override
    public void saveRecord(ContactOwnedRecord record) {
        Objects.requireNonNull(record, "record is required");
        commitLock.lock();
        try {
            if (!contacts.containsKey(record.contactId())) {
                throw new StoreException("Owning contact does not exist: " + record.contactId());
            }
            records.put(record.id(), record);
        } finally {
            commitLock.unlock();
        }
    }

    @Override
    public <T> T inTransaction(TransactionCallback<T> callback) {
        InMemoryTransaction tx = new InMemoryTransaction();
        T result = callback.doInTransaction(tx);
        tx.commit();
        return result;
    }

    /**
     * Number of contacts currently stored.
     */
    public int size() {
        return contacts.size();
    }

    public long recordCount() {
        return records.size();
    }

    private Contact nextVersion(Contact contact, Instant now) {
        return Contact.builder(contact)
                .version(contact.getVersion() + 1)
                .updatedAt(now)
                .build();
    }

    private void put(Contact contact) {
        unindex(contact.getId());
        contacts.put(contact.getId(), contact);
        Set<String> keys = blockingKeyStrategy.generateKeys(contact.identity()).all();
        keysByContact.put(contact.getId(), keys);
        for (String key : keys) {
            blockingIndex.computeIfAbsent(key, k -> ConcurrentHashMap.newKeySet()).add(contact.getId());
        }
    }

    private void remove(String contactId) {
        unindex(contactId);
        contacts.remove(contactId);
    }

    private void unindex(String contactId) {
        Set<String> previous = keysByContact.remove(contactId);
        if (previous == null) {
            return;
        }
        for (String key : previous) {
            blockingIndex.computeIfPresent(key, (k, ids) -> {
                ids.remove(contactId);
                return ids.isEmpty() ? null : ids;
            });
        }
    }

    private record Reassignment(RecordType type, String fromContactId, String toContactId) {
    }

    private class InMemoryTransaction implements StoreTransaction {
        private final Map<String, Long> expectedVersions = new LinkedHashMap<>();
        private final Map<String, Contact> updates = new LinkedHashMap<>();
        private final List<Reassignment> reassignments = new ArrayList<>();
        private final Set<String> deletes = new LinkedHashSet<>();
        private RelationshipCounts reassigned = RelationshipCounts.empty();

        @Override
        public Optional<Contact> findById(String contactId) {
            if (deletes.contains(contactId)) {
                return Optional.empty();
            }
            Contact pending = updates.get(contactId);
            return pending != null ? Optional.of(pending) : InMemoryContactStore.this.findById(contactId);
        }

        @Override
        public void reassignRecords(RecordType type, String fromContactId, String toContactId) {
            reassignments.add(new Reassignment(type, fromContactId, toContactId));
        }

        @Override
        public RelationshipCounts reassigned() {
            return reassigned;
        }

        @Override
        public void update(Contact contact) {
            expectedVersions.putIfAbsent(contact.getId(), contact.getVersion());
            updates.put(contact.getId(), contact);
        }

        @Override
        public void delete(String contactId, long expectedVersion) {
            expectedVersions.putIfAbsent(contactId, expectedVersion);
            updates.remove(contactId);
            deletes.add(contactId);
        }

        void commit() {
            if (expectedVersions.isEmpty() && reassignments.isEmpty()) {
                return;
            }
            commitLock.lock();
            try {
                for (Map.Entry<String, Long> guard : expectedVersions.entrySet()) {
                    Contact current = contacts.get(guard.getKey());
                    if (current == null || current.getVersion() != guard.getValue()) {
                        throw new StaleContactException(guard.getKey());
                    }
                }

                Instant now = Instant.now();
                for (Contact contact : updates.values()) {
                    put(nextVersion(contact, now));
                }
                Map<RecordType, Long> movedByType = new EnumMap<>(RecordType.class);
                for (Reassignment reassignment : reassignments) {
                    long moved = 0;
                    for (ContactOwnedRecord record : List.copyOf(records.values())) {
                        if (record.recordType() == reassignment.type()
                                && record.contactId().equals(reassignment.fromContactId())) {
                            records.put(record.id(), record.withContactId(reassignment.toContactId()));
                            moved++;
                        }
                    }
                    movedByType.merge(reassignment.type(), moved, Long::sum);
                    log.trace("store.recordsReassigned type={} from={} to={} count={}",
                            reassignment.type(), reassignment.fromContactId(), reassignment.toContactId(), moved);
                }
                for (String contactId : deletes) {
                    remove(contactId);
                }
                reassigned = RelationshipCounts.of(movedByType);
            } finally {
                commitLock.unlock();
            }
        }
    }
}
