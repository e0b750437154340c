package com.disease.normalization.graph;

import java.util.List;
import java.util.Map;

/**
 * Connection to the graph database holding source concepts, lookup terms and
 * merged concepts.
 */
public interface GraphConnection extends AutoCloseable {

    /**
     * Executes a Cypher statement that modifies the graph.
     *
     * @param query  the Cypher statement, with {@code $name} placeholders
     * @param params placeholder values; strings, numbers, booleans, nulls and lists of those
     */
    void execute(String query, Map<String, Object> params);

    default void execute(String query) {
        execute(query, Map.of());
    }

    /**
     * Executes a Cypher query and returns one map per result row, keyed by the
     * names in the RETURN clause.
     */
    List<Map<String, Object>> query(String query, Map<String, Object> params);

    default List<Map<String, Object>> query(String query) {
        return query(query, Map.of());
    }

    boolean isConnected();

    String getGraphName();

    /**
     * Creates the lookup indexes used by the concept store if they don't exist.
     */
    void createIndexes();
}
