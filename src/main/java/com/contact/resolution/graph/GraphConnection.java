package com.contact.resolution.graph;

import java.util.List;
import java.util.Map;

/**
 * Connection to the graph holding contacts and their owned records.
 * Parameters are referenced in queries as {@code $name}.
 */
public interface GraphConnection extends AutoCloseable {

    /**
     * Runs a write query, discarding any result.
     */
    void execute(String query, Map<String, Object> params);

    default void execute(String query) {
        execute(query, Map.of());
    }

    /**
     * Runs a query and returns one map per result row, keyed by column alias.
     */
    List<Map<String, Object>> query(String query, Map<String, Object> params);

    default List<Map<String, Object>> query(String query) {
        return query(query, Map.of());
    }

    /**
     * Issues a trivial query; false if it fails.
     */
    boolean isConnected();

    String getGraphName();

    /**
     * Creates indexes for contacts and their owned records if they don't exist.
     */
    void createIndexes();
}
