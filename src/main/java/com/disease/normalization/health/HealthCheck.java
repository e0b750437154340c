package com.disease.normalization.health;

/**
 * A single probe of one normalizer dependency, such as the graph database or
 * the concept store's contents.
 */
public interface HealthCheck {

    /**
     * Short stable name used as the key in aggregated health details.
     */
    String getName();

    HealthStatus check();
}
