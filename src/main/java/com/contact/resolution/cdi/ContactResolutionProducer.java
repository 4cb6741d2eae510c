package com.contact.resolution.cdi;

import com.contact.resolution.api.ContactResolver;
import com.contact.resolution.api.DeduplicationOptions;
import com.contact.resolution.cache.CacheConfig;
import com.contact.resolution.graph.FalkorDBConnection;
import com.contact.resolution.lock.LocalDistributedLock;
import com.contact.resolution.lock.LockConfig;
import com.contact.resolution.metrics.MetricsService;
import com.contact.resolution.metrics.MicrometerMetricsService;
import com.contact.resolution.metrics.NoOpMetricsService;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * CDI producer that wires the contact resolution library from MicroProfile Config properties.
 *
 * <h2>Configuration</h2>
 * <pre>
 * contact-resolution:
 *   store: falkordb          # or memory
 *   falkordb:
 *     host: localhost
 *     port: 6379
 *     graph-name: contacts
 * </pre>
 *
 * <p>When a Micrometer {@link MeterRegistry} bean is available, merge and search metrics are
 * recorded to it.</p>
 */
@ApplicationScoped
public class ContactResolutionProducer {

    private static final Logger log = LoggerFactory.getLogger(ContactResolutionProducer.class);

    // ── Storage ───────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "contact-resolution.store", defaultValue = "memory")
    String storeType;

    @Inject
    @ConfigProperty(name = "contact-resolution.falkordb.host", defaultValue = "localhost")
    String falkordbHost;

    @Inject
    @ConfigProperty(name = "contact-resolution.falkordb.port", defaultValue = "6379")
    int falkordbPort;

    @Inject
    @ConfigProperty(name = "contact-resolution.falkordb.graph-name", defaultValue = "contacts")
    String falkordbGraphName;

    // ── Scoring ───────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "contact-resolution.scoring.duplicate-threshold", defaultValue = "0.5")
    double duplicateThreshold;

    @Inject
    @ConfigProperty(name = "contact-resolution.scoring.name-similarity-threshold", defaultValue = "0.85")
    double nameSimilarityThreshold;

    @Inject
    @ConfigProperty(name = "contact-resolution.scoring.email-weight", defaultValue = "0.9")
    double emailWeight;

    @Inject
    @ConfigProperty(name = "contact-resolution.scoring.phone-weight", defaultValue = "0.8")
    double phoneWeight;

    @Inject
    @ConfigProperty(name = "contact-resolution.scoring.name-weight", defaultValue = "0.3")
    double nameWeight;

    @Inject
    @ConfigProperty(name = "contact-resolution.scoring.company-weight", defaultValue = "0.1")
    double companyWeight;

    @Inject
    @ConfigProperty(name = "contact-resolution.discovery.max-fuzzy-candidates", defaultValue = "500")
    int maxFuzzyCandidates;

    // ── Merge ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "contact-resolution.merge.max-conflict-retries", defaultValue = "3")
    int maxConflictRetries;

    @Inject
    @ConfigProperty(name = "contact-resolution.merge.lock-timeout-ms", defaultValue = "5000")
    long lockTimeoutMs;

    @Inject
    @ConfigProperty(name = "contact-resolution.merge.source-system", defaultValue = "system")
    String sourceSystem;

    // ── Cache ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "contact-resolution.cache.enabled", defaultValue = "true")
    boolean cacheEnabled;

    @Inject
    @ConfigProperty(name = "contact-resolution.cache.max-size", defaultValue = "5000")
    int cacheMaxSize;

    @Inject
    @ConfigProperty(name = "contact-resolution.cache.ttl-seconds", defaultValue = "30")
    int cacheTtlSeconds;

    @Inject
    Instance<MeterRegistry> meterRegistry;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public ContactResolver contactResolver() {
        DeduplicationOptions options = DeduplicationOptions.builder()
                .duplicateThreshold(duplicateThreshold)
                .nameSimilarityThreshold(nameSimilarityThreshold)
                .emailWeight(emailWeight)
                .phoneWeight(phoneWeight)
                .fuzzyNameWeight(nameWeight)
                .companyWeight(companyWeight)
                .maxFuzzyCandidates(maxFuzzyCandidates)
                .maxConflictRetries(maxConflictRetries)
                .sourceSystem(sourceSystem)
                .build();

        ContactResolver.Builder builder = ContactResolver.builder()
                .options(options)
                .distributedLock(new LocalDistributedLock(new LockConfig(lockTimeoutMs)))
                .cacheConfig(cacheEnabled ? new CacheConfig(cacheMaxSize, cacheTtlSeconds, true) : CacheConfig.disabled())
                .metricsService(metricsService());

        if ("falkordb".equalsIgnoreCase(storeType)) {
            log.info("Producing ContactResolver: falkordb={}:{}/{}", falkordbHost, falkordbPort, falkordbGraphName);
            builder.ownedGraphConnection(new FalkorDBConnection(falkordbHost, falkordbPort, falkordbGraphName));
        } else {
            if (!"memory".equalsIgnoreCase(storeType)) {
                log.warn("Unknown store type '{}', falling back to memory", storeType);
            }
            log.info("Producing ContactResolver: in-memory store");
        }
        return builder.build();
    }

    public void closeResolver(@Disposes ContactResolver resolver) {
        log.info("Closing ContactResolver");
        resolver.close();
    }

    private MetricsService metricsService() {
        if (meterRegistry != null && meterRegistry.isResolvable()) {
            return new MicrometerMetricsService(meterRegistry.get());
        }
        return new NoOpMetricsService();
    }
}
