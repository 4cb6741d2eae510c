package com.contact.resolution.graph;

import com.contact.resolution.core.model.AnalyticsEvent;
import com.contact.resolution.core.model.Contact;
import com.contact.resolution.core.model.ContactOwnedRecord;
import com.contact.resolution.core.model.ContactStatus;
import com.contact.resolution.core.model.CustomFields;
import com.contact.resolution.core.model.Message;
import com.contact.resolution.core.model.MessageChannel;
import com.contact.resolution.core.model.MessageDirection;
import com.contact.resolution.core.model.MessageStatus;
import com.contact.resolution.core.model.Note;
import com.contact.resolution.core.model.NoteVisibility;
import com.contact.resolution.core.model.RecordType;
import com.contact.resolution.core.model.RelationshipCounts;
import com.contact.resolution.core.model.ScheduleStatus;
import com.contact.resolution.core.model.ScheduledMessage;
import com.contact.resolution.similarity.BlockingKeyStrategy;
import com.contact.resolution.similarity.DefaultBlockingKeyStrategy;
import com.contact.resolution.store.ContactStore;
import com.contact.resolution.store.StaleContactException;
import com.contact.resolution.store.StoreException;
import com.contact.resolution.store.StoreTransaction;
import com.contact.resolution.store.TransactionCallback;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Contact store backed by a FalkorDB graph.
 *
 * <p>Contacts are {@code Contact} nodes carrying their blocking keys as a list property.
 * Owned records are nodes labelled by record type that point at their contact through a
 * {@code contactId} property. A transaction commits as one Cypher statement.</p>
 */
public class GraphContactStore implements ContactStore {
    private static final Logger log = LoggerFactory.getLogger(GraphContactStore.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final ContactCypherExecutor executor;
    private final BlockingKeyStrategy blockingKeyStrategy;

    public GraphContactStore(GraphConnection connection) {
        this(connection, new DefaultBlockingKeyStrategy());
    }

    public GraphContactStore(GraphConnection connection, BlockingKeyStrategy blockingKeyStrategy) {
        this(new ContactCypherExecutor(connection), blockingKeyStrategy);
    }

    public GraphContactStore(ContactCypherExecutor executor, BlockingKeyStrategy blockingKeyStrategy) {
        this.executor = Objects.requireNonNull(executor, "executor is required");
        this.blockingKeyStrategy = Objects.requireNonNull(blockingKeyStrategy, "blockingKeyStrategy is required");
    }

    @Override
    public Optional<Contact> findById(String contactId) {
        if (contactId == null) {
            return Optional.empty();
        }
        List<Map<String, Object>> rows = executor.findContactById(contactId);
        if (rows.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(mapToContact(rows.get(0)));
    }

    @Override
    public List<Contact> findByIds(Collection<String> contactIds) {
        if (contactIds.isEmpty()) {
            return List.of();
        }
        Map<String, Contact> byId = new LinkedHashMap<>();
        for (Map<String, Object> row : executor.findContactsByIds(List.copyOf(contactIds))) {
            Contact contact = mapToContact(row);
            byId.put(contact.getId(), contact);
        }
        List<Contact> found = new ArrayList<>(byId.size());
        for (String id : contactIds) {
            Contact contact = byId.get(id);
            if (contact != null) {
                found.add(contact);
            }
        }
        return found;
    }

    @Override
    public Set<String> findIdsByBlockingKeys(Set<String> keys, int limit) {
        if (keys.isEmpty()) {
            return Set.of();
        }
        Set<String> ids = new LinkedHashSet<>();
        for (Map<String, Object> row : executor.findContactIdsByBlockingKeys(List.copyOf(new TreeSet<>(keys)), limit)) {
            ids.add((String) row.get("id"));
        }
        return ids;
    }

    @Override
    public RelationshipCounts countRelationships(String contactId) {
        Map<RecordType, Long> counts = new EnumMap<>(RecordType.class);
        for (RecordType type : RecordType.values()) {
            counts.put(type, executor.countRecords(type, contactId));
        }
        return RelationshipCounts.of(counts);
    }

    @Override
    public List<ContactOwnedRecord> findRecords(String contactId, RecordType type) {
        return executor.findRecords(type, contactId).stream()
                .map(row -> mapToRecord(type, row))
                .toList();
    }

    @Override
    public Contact save(Contact contact) {
        Objects.requireNonNull(contact, "contact is required");
        Optional<Contact> existing = findById(contact.getId());
        if (existing.isEmpty()) {
            Contact stored = Contact.builder(contact).version(1).build();
            executor.createContact(toProperties(stored));
            log.debug("store.contactCreated contactId={}", stored.getId());
            return stored;
        }
        Contact stored = Contact.builder(contact)
                .version(contact.getVersion() + 1)
                .updatedAt(Instant.now())
                .build();
        if (executor.updateContactIfVersion(contact.getId(), contact.getVersion(), toProperties(stored)).isEmpty()) {
            throw new StaleContactException(contact.getId());
        }
        log.debug("store.contactSaved contactId={} version={}", stored.getId(), stored.getVersion());
        return stored;
    }

    @Override
    public void saveRecord(ContactOwnedRecord record) {
        Objects.requireNonNull(record, "record is required");
        if (executor.createRecord(record.recordType(), toProperties(record)).isEmpty()) {
            throw new StoreException("Owning contact does not exist: " + record.contactId());
        }
    }

    @Override
    public <T> T inTransaction(TransactionCallback<T> callback) {
        GraphTransaction transaction = new GraphTransaction();
        T result = callback.doInTransaction(transaction);
        CommitStatement statement = transaction.statement;
        Map<String, Object> applied = executor.commit(statement)
                .orElseThrow(() -> staleContact(statement.guards()));
        transaction.reassigned = statement.movedCounts(applied);
        return result;
    }

    private StoreException staleContact(Map<String, Long> guards) {
        Map<String, Long> current = new LinkedHashMap<>();
        for (Map<String, Object> row : executor.findContactVersions(List.copyOf(guards.keySet()))) {
            current.put((String) row.get("id"), toLong(row.get("version")));
        }
        for (Map.Entry<String, Long> guard : guards.entrySet()) {
            if (!guard.getValue().equals(current.get(guard.getKey()))) {
                return new StaleContactException(guard.getKey());
            }
        }
        return new StoreException("Transaction was not applied");
    }

    private class GraphTransaction implements StoreTransaction {
        private final CommitStatement statement = new CommitStatement();
        private RelationshipCounts reassigned = RelationshipCounts.empty();

        @Override
        public Optional<Contact> findById(String contactId) {
            return GraphContactStore.this.findById(contactId);
        }

        @Override
        public void reassignRecords(RecordType type, String fromContactId, String toContactId) {
            statement.reassign(type, fromContactId, toContactId);
        }

        @Override
        public RelationshipCounts reassigned() {
            return reassigned;
        }

        @Override
        public void update(Contact contact) {
            Contact next = Contact.builder(contact)
                    .version(contact.getVersion() + 1)
                    .updatedAt(Instant.now())
                    .build();
            statement.update(contact.getId(), contact.getVersion(), toProperties(next));
        }

        @Override
        public void delete(String contactId, long expectedVersion) {
            statement.delete(contactId, expectedVersion);
        }
    }

    // ========== Mapping ==========

    Map<String, Object> toProperties(Contact contact) {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("id", contact.getId());
        properties.put("firstName", contact.getFirstName());
        properties.put("lastName", contact.getLastName());
        properties.put("email", contact.getEmail());
        properties.put("phone", contact.getPhone());
        properties.put("whatsapp", contact.getWhatsapp());
        properties.put("company", contact.getCompany());
        properties.put("jobTitle", contact.getJobTitle());
        properties.put("status", contact.getStatus().name());
        properties.put("tags", List.copyOf(contact.getTags()));
        properties.put("customFields", writeCustomFields(contact.getCustomFields()));
        properties.put("lastContactedAt", toMillis(contact.getLastContactedAt()));
        properties.put("createdAt", toMillis(contact.getCreatedAt()));
        properties.put("updatedAt", toMillis(contact.getUpdatedAt()));
        properties.put("version", contact.getVersion());
        properties.put("blockingKeys", List.copyOf(new TreeSet<>(blockingKeyStrategy.generateKeys(contact.identity()).all())));
        return properties;
    }

    Contact mapToContact(Map<String, Object> row) {
        Contact.Builder builder = Contact.builder()
                .id((String) row.get("id"))
                .firstName((String) row.get("firstName"))
                .lastName((String) row.get("lastName"))
                .email((String) row.get("email"))
                .phone((String) row.get("phone"))
                .whatsapp((String) row.get("whatsapp"))
                .company((String) row.get("company"))
                .jobTitle((String) row.get("jobTitle"))
                .customFields(readCustomFields((String) row.get("customFields")))
                .lastContactedAt(toInstant(row.get("lastContactedAt")))
                .version(toLong(row.get("version")));

        Object status = row.get("status");
        if (status != null) {
            builder.status(ContactStatus.valueOf((String) status));
        }
        if (row.get("tags") instanceof Collection<?> tags) {
            builder.tags(tags.stream().map(String::valueOf).toList());
        }
        Instant createdAt = toInstant(row.get("createdAt"));
        if (createdAt != null) {
            builder.createdAt(createdAt);
        }
        Instant updatedAt = toInstant(row.get("updatedAt"));
        if (updatedAt != null) {
            builder.updatedAt(updatedAt);
        }
        return builder.build();
    }

    static Map<String, Object> toProperties(ContactOwnedRecord record) {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("id", record.id());
        properties.put("contactId", record.contactId());
        properties.put("createdAt", toMillis(record.createdAt()));
        if (record instanceof Message message) {
            properties.put("channel", message.channel().name());
            properties.put("direction", message.direction().name());
            properties.put("status", message.status().name());
            properties.put("content", message.content());
        } else if (record instanceof Note note) {
            properties.put("userId", note.userId());
            properties.put("content", note.content());
            properties.put("visibility", note.visibility().name());
        } else if (record instanceof ScheduledMessage scheduled) {
            properties.put("channel", scheduled.channel().name());
            properties.put("content", scheduled.content());
            properties.put("scheduledAt", toMillis(scheduled.scheduledAt()));
            properties.put("status", scheduled.status().name());
        } else if (record instanceof AnalyticsEvent event) {
            properties.put("channel", event.channel().name());
            properties.put("eventType", event.eventType());
        }
        return properties;
    }

    static ContactOwnedRecord mapToRecord(RecordType type, Map<String, Object> row) {
        String id = (String) row.get("id");
        String contactId = (String) row.get("contactId");
        Instant createdAt = toInstant(row.get("createdAt"));
        return switch (type) {
            case MESSAGE -> new Message(id, contactId,
                    MessageChannel.valueOf((String) row.get("channel")),
                    MessageDirection.valueOf((String) row.get("direction")),
                    enumOrNull(MessageStatus.class, row.get("status")),
                    (String) row.get("content"), createdAt);
            case NOTE -> new Note(id, contactId, (String) row.get("userId"), (String) row.get("content"),
                    enumOrNull(NoteVisibility.class, row.get("visibility")), createdAt);
            case SCHEDULED_MESSAGE -> new ScheduledMessage(id, contactId,
                    MessageChannel.valueOf((String) row.get("channel")),
                    (String) row.get("content"), toInstant(row.get("scheduledAt")),
                    enumOrNull(ScheduleStatus.class, row.get("status")), createdAt);
            case ANALYTICS_EVENT -> new AnalyticsEvent(id, contactId,
                    MessageChannel.valueOf((String) row.get("channel")),
                    (String) row.get("eventType"), createdAt);
        };
    }

    private static String writeCustomFields(CustomFields customFields) {
        try {
            return MAPPER.writeValueAsString(customFields.toJson());
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to serialize custom fields", e);
        }
    }

    private static CustomFields readCustomFields(String json) {
        if (json == null || json.isBlank()) {
            return CustomFields.empty();
        }
        try {
            return CustomFields.fromJson(MAPPER.readTree(json));
        } catch (JsonProcessingException e) {
            throw new StoreException("Stored custom fields are not valid JSON", e);
        }
    }

    private static <E extends Enum<E>> E enumOrNull(Class<E> type, Object value) {
        return value == null ? null : Enum.valueOf(type, (String) value);
    }

    private static Long toMillis(Instant instant) {
        return instant == null ? null : instant.toEpochMilli();
    }

    private static Instant toInstant(Object value) {
        return value instanceof Number n ? Instant.ofEpochMilli(n.longValue()) : null;
    }

    private static long toLong(Object value) {
        return value instanceof Number n ? n.longValue() : 0L;
    }
}
