package com.contact.resolution.graph;

import com.contact.resolution.core.model.RecordType;
import com.contact.resolution.core.model.RelationshipCounts;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Composes the buffered writes of one transaction into a single Cypher statement.
 *
 * <p>Every touched contact is matched first with its expected version. If any guard fails
 * nothing is written and {@code applied} is zero. Each reassignment also returns the number
 * of records it moved as {@code moved<i>n</i>}.</p>
 */
public class CommitStatement {

    private final Map<String, Long> guards = new LinkedHashMap<>();
    private final Map<String, Map<String, Object>> updates = new LinkedHashMap<>();
    private final List<Reassignment> reassignments = new ArrayList<>();
    private final List<String> deletes = new ArrayList<>();

    private record Reassignment(RecordType type, String fromContactId, String toContactId) {
    }

    /**
     * Replaces the contact's properties if its version is still {@code expectedVersion}.
     */
    public CommitStatement update(String contactId, long expectedVersion, Map<String, Object> properties) {
        guards.putIfAbsent(contactId, expectedVersion);
        updates.put(contactId, properties);
        return this;
    }

    public CommitStatement reassign(RecordType type, String fromContactId, String toContactId) {
        reassignments.add(new Reassignment(type, fromContactId, toContactId));
        return this;
    }

    public CommitStatement delete(String contactId, long expectedVersion) {
        guards.putIfAbsent(contactId, expectedVersion);
        if (!deletes.contains(contactId)) {
            deletes.add(contactId);
        }
        return this;
    }

    public boolean isEmpty() {
        return guards.isEmpty() && reassignments.isEmpty();
    }

    /**
     * Expected version per guarded contact id.
     */
    public Map<String, Long> guards() {
        return Map.copyOf(guards);
    }

    int guardCount() {
        return guards.size();
    }

    int updateCount() {
        return updates.size();
    }

    int reassignmentCount() {
        return reassignments.size();
    }

    int deleteCount() {
        return deletes.size();
    }

    public String query() {
        return render(new HashMap<>());
    }

    public Map<String, Object> params() {
        Map<String, Object> params = new HashMap<>();
        render(params);
        return params;
    }

    private String render(Map<String, Object> params) {
        StringBuilder query = new StringBuilder();
        Map<String, String> variables = new LinkedHashMap<>();

        int index = 0;
        for (Map.Entry<String, Long> guard : guards.entrySet()) {
            String variable = "c" + index++;
            variables.put(guard.getKey(), variable);
            query.append("MATCH (").append(variable).append(":Contact {id: $").append(variable).append("_id})")
                    .append(" WHERE ").append(variable).append(".version = $").append(variable).append("_guard\n");
            params.put(variable + "_id", guard.getKey());
            params.put(variable + "_guard", guard.getValue());
        }

        String carried = String.join(", ", variables.values());
        if (carried.isEmpty()) {
            query.append("UNWIND [1] AS tx\n");
            carried = "tx";
        }

        for (Map.Entry<String, Map<String, Object>> update : updates.entrySet()) {
            String variable = variables.get(update.getKey());
            query.append("SET ")
                    .append(ContactCypherExecutor.setClause(variable, variable, update.getValue(), params))
                    .append('\n');
        }

        for (int i = 0; i < reassignments.size(); i++) {
            Reassignment reassignment = reassignments.get(i);
            String record = "r" + i;
            String collected = "rs" + i;
            query.append("WITH ").append(carried).append('\n')
                    .append("OPTIONAL MATCH (").append(record).append(':').append(reassignment.type().label())
                    .append(" {contactId: $").append(record).append("_from})\n")
                    .append("WITH ").append(carried).append(", collect(").append(record).append(") AS ")
                    .append(collected).append('\n')
                    .append("FOREACH (x IN ").append(collected).append(" | SET x.contactId = $")
                    .append(record).append("_to)\n");
            params.put(record + "_from", reassignment.fromContactId());
            params.put(record + "_to", reassignment.toContactId());
            carried = carried + ", " + collected;
        }

        if (!deletes.isEmpty()) {
            query.append("WITH ").append(carried).append('\n');
            List<String> deleted = deletes.stream().map(variables::get).toList();
            query.append("DETACH DELETE ").append(String.join(", ", deleted)).append('\n');
        }

        query.append("RETURN count(*) AS applied");
        for (int i = 0; i < reassignments.size(); i++) {
            query.append(", sum(size(rs").append(i).append(")) AS moved").append(i);
        }
        return query.toString();
    }

    /**
     * Reads the per-type moved counts from the row returned by an applied statement.
     */
    public RelationshipCounts movedCounts(Map<String, Object> row) {
        Map<RecordType, Long> moved = new EnumMap<>(RecordType.class);
        for (int i = 0; i < reassignments.size(); i++) {
            long count = row.get("moved" + i) instanceof Number n ? n.longValue() : 0L;
            moved.merge(reassignments.get(i).type(), count, Long::sum);
        }
        return RelationshipCounts.of(moved);
    }
}
