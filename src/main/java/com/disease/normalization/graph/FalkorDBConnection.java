package com.disease.normalization.graph;

import com.falkordb.Driver;
import com.falkordb.FalkorDB;
import com.falkordb.Graph;
import com.falkordb.Record;
import com.falkordb.ResultSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link GraphConnection} to a FalkorDB graph through the JFalkorDB client.
 *
 * <p>Parameters travel separately from the query text and are encoded by the
 * client, so values containing {@code $name} or quotes are stored as given.</p>
 */
public class FalkorDBConnection implements GraphConnection {
    private static final Logger log = LoggerFactory.getLogger(FalkorDBConnection.class);

    private final Driver driver;
    private final Graph graph;
    private final String graphName;

    public FalkorDBConnection(String host, int port, String graphName) {
        this.driver = FalkorDB.driver(host, port);
        this.graphName = graphName;
        this.graph = driver.graph(graphName);
        log.info("falkordb.connected host={} port={} graph={}", host, port, graphName);
    }

    FalkorDBConnection(Driver driver, Graph graph, String graphName) {
        this.driver = driver;
        this.graph = graph;
        this.graphName = graphName;
    }

    @Override
    public void execute(String query, Map<String, Object> params) {
        log.trace("falkordb.execute query={} params={}", query, params.keySet());
        graph.query(query, params);
    }

    @Override
    public List<Map<String, Object>> query(String query, Map<String, Object> params) {
        log.trace("falkordb.query query={} params={}", query, params.keySet());

        ResultSet resultSet = graph.query(query, params);
        List<Map<String, Object>> rows = new ArrayList<>();
        for (Record record : resultSet) {
            Map<String, Object> row = new HashMap<>();
            for (String key : record.keys()) {
                row.put(key, record.getValue(key));
            }
            rows.add(row);
        }
        return rows;
    }

    @Override
    public boolean isConnected() {
        try {
            graph.query("RETURN 1");
            return true;
        } catch (Exception e) {
            log.warn("falkordb.ping.failed graph={} error={}", graphName, e.getMessage());
            return false;
        }
    }

    @Override
    public String getGraphName() {
        return graphName;
    }

    @Override
    public void createIndexes() {
        safeExecute("CREATE INDEX FOR (c:SourceConcept) ON (c.conceptIdLower)");
        safeExecute("CREATE INDEX FOR (c:SourceConcept) ON (c.sourceName)");
        safeExecute("CREATE INDEX FOR (t:Term) ON (t.valueLower)");
        safeExecute("CREATE INDEX FOR (m:MergedConcept) ON (m.conceptIdLower)");
        safeExecute("CREATE INDEX FOR (m:MergedConcept) ON (m.version)");
        log.info("falkordb.indexes.created graph={}", graphName);
    }

    private void safeExecute(String query) {
        try {
            graph.query(query);
        } catch (Exception e) {
            // Index already exists
            log.debug("falkordb.index.skipped query={} reason={}", query, e.getMessage());
        }
    }

    @Override
    public void close() {
        try {
            driver.close();
        } catch (Exception e) {
            log.warn("falkordb.close.failed graph={} error={}", graphName, e.getMessage());
        }
        log.info("falkordb.closed graph={}", graphName);
    }
}
