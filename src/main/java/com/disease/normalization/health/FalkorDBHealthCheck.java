package com.disease.normalization.health;

import com.disease.normalization.graph.GraphConnection;

import java.util.concurrent.TimeUnit;

/**
 * Pings the FalkorDB graph and reports round-trip latency.
 */
public class FalkorDBHealthCheck implements HealthCheck {

    private final GraphConnection connection;

    public FalkorDBHealthCheck(GraphConnection connection) {
        this.connection = connection;
    }

    @Override
    public String getName() {
        return "falkordb";
    }

    @Override
    public HealthStatus check() {
        long start = System.nanoTime();
        try {
            connection.query("RETURN 1");
        } catch (Exception e) {
            return HealthStatus.down("FalkorDB unreachable: " + e.getMessage())
                    .withDetail("graphName", connection.getGraphName())
                    .withDetail("error", e.getClass().getSimpleName());
        }
        return HealthStatus.up()
                .withDetail("graphName", connection.getGraphName())
                .withDetail("latencyMs", TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
    }
}
