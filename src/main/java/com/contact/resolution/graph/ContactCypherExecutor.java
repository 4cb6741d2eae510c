package com.contact.resolution.graph;

import com.contact.resolution.core.model.RecordType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Executes Cypher queries for contacts and the records they own.
 */
public class ContactCypherExecutor {
    private static final Logger log = LoggerFactory.getLogger(ContactCypherExecutor.class);

    static final String CONTACT_COLUMNS = """
            c.id AS id, c.firstName AS firstName, c.lastName AS lastName, c.email AS email,
                   c.phone AS phone, c.whatsapp AS whatsapp, c.company AS company, c.jobTitle AS jobTitle,
                   c.status AS status, c.tags AS tags, c.customFields AS customFields,
                   c.lastContactedAt AS lastContactedAt, c.createdAt AS createdAt, c.updatedAt AS updatedAt,
                   c.version AS version""";

    static final String RECORD_COLUMNS = """
            r.id AS id, r.contactId AS contactId, r.channel AS channel, r.direction AS direction,
                   r.status AS status, r.content AS content, r.userId AS userId, r.visibility AS visibility,
                   r.scheduledAt AS scheduledAt, r.eventType AS eventType, r.createdAt AS createdAt""";

    private final GraphConnection connection;

    public ContactCypherExecutor(GraphConnection connection) {
        this.connection = connection;
    }

    public GraphConnection getConnection() {
        return connection;
    }

    // ========== Contacts ==========

    public List<Map<String, Object>> findContactById(String contactId) {
        String query = """
                MATCH (c:Contact {id: $contactId})
                RETURN %s
                """.formatted(CONTACT_COLUMNS);
        return connection.query(query, Map.of("contactId", contactId));
    }

    public List<Map<String, Object>> findContactsByIds(List<String> contactIds) {
        String query = """
                MATCH (c:Contact)
                WHERE c.id IN $contactIds
                RETURN %s
                """.formatted(CONTACT_COLUMNS);
        return connection.query(query, Map.of("contactIds", contactIds));
    }

    /**
     * Ids of contacts carrying any of the keys, ordered by id.
     */
    public List<Map<String, Object>> findContactIdsByBlockingKeys(List<String> keys, int limit) {
        String query = """
                MATCH (c:Contact)
                WHERE any(k IN c.blockingKeys WHERE k IN $keys)
                RETURN c.id AS id
                ORDER BY c.id
                """;
        Map<String, Object> params = new HashMap<>();
        params.put("keys", keys);
        if (limit > 0) {
            query = query + "LIMIT $limit\n";
            params.put("limit", limit);
        }
        return connection.query(query, params);
    }

    public List<Map<String, Object>> findContactVersions(List<String> contactIds) {
        String query = """
                MATCH (c:Contact)
                WHERE c.id IN $contactIds
                RETURN c.id AS id, c.version AS version
                """;
        return connection.query(query, Map.of("contactIds", contactIds));
    }

    /**
     * Creates a contact node. Null properties are left unset.
     */
    public void createContact(Map<String, Object> properties) {
        Map<String, Object> present = new LinkedHashMap<>();
        properties.forEach((key, value) -> {
            if (value != null) {
                present.put(key, value);
            }
        });
        connection.execute("CREATE (c:Contact $properties)", Map.of("properties", present));
    }

    /**
     * Replaces a contact's properties if its version still matches.
     *
     * @return the new version, or an empty list if the guard failed
     */
    public List<Map<String, Object>> updateContactIfVersion(String contactId, long expectedVersion,
                                                            Map<String, Object> properties) {
        Map<String, Object> params = new HashMap<>();
        params.put("contactId", contactId);
        params.put("expectedVersion", expectedVersion);
        String query = """
                MATCH (c:Contact {id: $contactId})
                WHERE c.version = $expectedVersion
                SET %s
                RETURN c.version AS version
                """.formatted(setClause("c", "p", properties, params));
        return connection.query(query, params);
    }

    // ========== Owned records ==========

    /**
     * Creates a record node for an existing contact.
     *
     * @return the created id, or an empty list if the owning contact does not exist
     */
    public List<Map<String, Object>> createRecord(RecordType type, Map<String, Object> properties) {
        Map<String, Object> present = new LinkedHashMap<>();
        properties.forEach((key, value) -> {
            if (value != null) {
                present.put(key, value);
            }
        });
        String query = """
                MATCH (c:Contact {id: $contactId})
                CREATE (r:%s $properties)
                RETURN r.id AS id
                """.formatted(type.label());
        return connection.query(query, Map.of(
                "contactId", properties.get("contactId"),
                "properties", present
        ));
    }

    public List<Map<String, Object>> findRecords(RecordType type, String contactId) {
        String query = """
                MATCH (r:%s {contactId: $contactId})
                RETURN %s
                ORDER BY r.createdAt, r.id
                """.formatted(type.label(), RECORD_COLUMNS);
        return connection.query(query, Map.of("contactId", contactId));
    }

    public long countRecords(RecordType type, String contactId) {
        String query = """
                MATCH (r:%s {contactId: $contactId})
                RETURN count(r) AS count
                """.formatted(type.label());
        List<Map<String, Object>> rows = connection.query(query, Map.of("contactId", contactId));
        if (rows.isEmpty() || rows.get(0).get("count") == null) {
            return 0;
        }
        return ((Number) rows.get(0).get("count")).longValue();
    }

    // ========== Transactions ==========

    /**
     * Runs the statement as one query.
     *
     * @return the result row if every version guard held and the writes were applied,
     *         empty otherwise; an empty statement yields an empty row without a query
     */
    public Optional<Map<String, Object>> commit(CommitStatement statement) {
        if (statement.isEmpty()) {
            return Optional.of(Map.of());
        }
        String query = statement.query();
        log.debug("Committing transaction: guards={} updates={} reassignments={} deletes={}",
                statement.guardCount(), statement.updateCount(),
                statement.reassignmentCount(), statement.deleteCount());
        List<Map<String, Object>> rows = connection.query(query, statement.params());
        if (rows.isEmpty()) {
            return Optional.empty();
        }
        Map<String, Object> row = rows.get(0);
        return row.get("applied") instanceof Number n && n.longValue() > 0 ? Optional.of(row) : Optional.empty();
    }

    /**
     * Renders {@code var.key = $prefix_key} assignments, adding the values to {@code params}.
     */
    static String setClause(String variable, String prefix, Map<String, Object> properties,
                            Map<String, Object> params) {
        List<String> assignments = new ArrayList<>(properties.size());
        properties.forEach((key, value) -> {
            String param = prefix + "_" + key;
            assignments.add(variable + "." + key + " = $" + param);
            params.put(param, value);
        });
        return String.join(", ", assignments);
    }
}
