package com.disease.normalization.health;

import com.disease.normalization.store.ConceptStore;

/**
 * Reports whether the concept store is ready to answer queries: its schema
 * exists (DOWN otherwise) and it holds source and merged records (DEGRADED
 * otherwise, typically before the first rebuild).
 */
public class ConceptStoreHealthCheck implements HealthCheck {

    private final ConceptStore store;

    public ConceptStoreHealthCheck(ConceptStore store) {
        this.store = store;
    }

    @Override
    public String getName() {
        return "conceptStore";
    }

    @Override
    public HealthStatus check() {
        if (!store.isInitialized()) {
            return HealthStatus.down("Concept store schema is not initialized")
                    .withDetail("initialized", false);
        }
        if (!store.isPopulated()) {
            return HealthStatus.degraded("Concept store has no source or merged records; run a rebuild")
                    .withDetail("initialized", true)
                    .withDetail("populated", false);
        }
        return HealthStatus.up()
                .withDetail("initialized", true)
                .withDetail("populated", true);
    }
}
