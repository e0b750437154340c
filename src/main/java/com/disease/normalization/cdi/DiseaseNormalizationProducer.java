package com.disease.normalization.cdi;

import com.disease.normalization.api.DiseaseNormalizer;
import com.disease.normalization.api.NormalizerOptions;
import com.disease.normalization.cache.CacheConfig;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * CDI producer that wires the disease normalizer from MicroProfile Config properties.
 *
 * <pre>
 * disease-normalizer:
 *   store: falkordb          # or memory
 *   rebuild-on-startup: true
 *   falkordb:
 *     host: localhost
 *     port: 6379
 *     graph-name: disease-normalizer
 *   cache:
 *     enabled: true
 *     max-size: 50000
 *     ttl-seconds: 3600
 * </pre>
 */
@ApplicationScoped
public class DiseaseNormalizationProducer {

    private static final Logger log = LoggerFactory.getLogger(DiseaseNormalizationProducer.class);

    static final String STORE_MEMORY = "memory";
    static final String STORE_FALKORDB = "falkordb";

    // ── Storage ───────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "disease-normalizer.store", defaultValue = STORE_FALKORDB)
    String storeType;

    @Inject
    @ConfigProperty(name = "disease-normalizer.falkordb.host", defaultValue = "localhost")
    String falkordbHost;

    @Inject
    @ConfigProperty(name = "disease-normalizer.falkordb.port", defaultValue = "6379")
    int falkordbPort;

    @Inject
    @ConfigProperty(name = "disease-normalizer.falkordb.graph-name", defaultValue = "disease-normalizer")
    String falkordbGraphName;

    @Inject
    @ConfigProperty(name = "disease-normalizer.falkordb.create-indexes", defaultValue = "true")
    boolean createIndexes;

    @Inject
    @ConfigProperty(name = "disease-normalizer.rebuild-on-startup", defaultValue = "false")
    boolean rebuildOnStartup;

    // ── Cache ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "disease-normalizer.cache.enabled", defaultValue = "true")
    boolean cacheEnabled;

    @Inject
    @ConfigProperty(name = "disease-normalizer.cache.max-size", defaultValue = "50000")
    int cacheMaxSize;

    @Inject
    @ConfigProperty(name = "disease-normalizer.cache.ttl-seconds", defaultValue = "3600")
    int cacheTtlSeconds;

    @Produces
    @ApplicationScoped
    public DiseaseNormalizer diseaseNormalizer() {
        DiseaseNormalizer.Builder builder = DiseaseNormalizer.builder().options(options());
        if (STORE_MEMORY.equalsIgnoreCase(storeType)) {
            log.info("Producing DiseaseNormalizer: store=memory");
        } else {
            if (!STORE_FALKORDB.equalsIgnoreCase(storeType)) {
                log.warn("Unknown store type '{}', falling back to falkordb", storeType);
            }
            log.info("Producing DiseaseNormalizer: falkordb={}:{}/{}", falkordbHost, falkordbPort, falkordbGraphName);
            builder.falkorDB(falkordbHost, falkordbPort, falkordbGraphName);
        }
        return builder.build();
    }

    public void closeNormalizer(@Disposes DiseaseNormalizer normalizer) {
        log.info("Closing DiseaseNormalizer");
        normalizer.close();
    }

    NormalizerOptions options() {
        CacheConfig cacheConfig = new CacheConfig(cacheMaxSize, cacheTtlSeconds, cacheEnabled);
        return NormalizerOptions.builder()
                .cacheConfig(cacheConfig)
                .createIndexes(createIndexes)
                .rebuildOnStartup(rebuildOnStartup)
                .build();
    }
}
