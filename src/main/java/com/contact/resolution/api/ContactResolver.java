package com.contact.resolution.api;

import com.contact.resolution.audit.AuditService;
import com.contact.resolution.audit.MergeLedger;
import com.contact.resolution.cache.CacheConfig;
import com.contact.resolution.cache.CacheStats;
import com.contact.resolution.cache.CaffeineCandidateCache;
import com.contact.resolution.cache.CandidateCache;
import com.contact.resolution.cache.MergeListener;
import com.contact.resolution.cache.NoOpCandidateCache;
import com.contact.resolution.core.exception.ContactNotFoundException;
import com.contact.resolution.core.exception.ValidationException;
import com.contact.resolution.core.model.Contact;
import com.contact.resolution.core.model.ContactOwnedRecord;
import com.contact.resolution.core.model.DuplicateCandidate;
import com.contact.resolution.core.model.IdentityTuple;
import com.contact.resolution.core.model.MergeRecord;
import com.contact.resolution.core.model.RelationshipCounts;
import com.contact.resolution.discovery.DuplicateCandidateFinder;
import com.contact.resolution.graph.GraphConnection;
import com.contact.resolution.graph.GraphContactStore;
import com.contact.resolution.lock.DistributedLock;
import com.contact.resolution.lock.LocalDistributedLock;
import com.contact.resolution.merge.BatchMergeResult;
import com.contact.resolution.merge.MergeExecutor;
import com.contact.resolution.merge.MergeResult;
import com.contact.resolution.merge.MergeStrategy;
import com.contact.resolution.merge.MergeStrategyResolver;
import com.contact.resolution.merge.RelationshipMigrator;
import com.contact.resolution.metrics.MetricsService;
import com.contact.resolution.metrics.NoOpMetricsService;
import com.contact.resolution.rules.DefaultNormalizationRules;
import com.contact.resolution.rules.NormalizationEngine;
import com.contact.resolution.rules.PhoneNormalizer;
import com.contact.resolution.similarity.BlockingKeyStrategy;
import com.contact.resolution.similarity.ContactSimilarityScorer;
import com.contact.resolution.similarity.DefaultBlockingKeyStrategy;
import com.contact.resolution.similarity.LevenshteinSimilarity;
import com.contact.resolution.store.ContactStore;
import com.contact.resolution.store.InMemoryContactStore;
import com.contact.resolution.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Main entry point for contact identity resolution.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * ContactResolver resolver = ContactResolver.builder()
 *     .store(new InMemoryContactStore())
 *     .build();
 *
 * List&lt;DuplicateCandidate&gt; candidates = resolver.findDuplicates(
 *     IdentityTuple.of("John", "Smith", "john@example.com", null));
 *
 * MergeResult result = resolver.mergeContacts(primaryId, candidates.get(0).contactId());
 * </pre>
 */
public class ContactResolver implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ContactResolver.class);

    private final ContactStore store;
    private final GraphConnection ownedConnection;
    private final DeduplicationOptions options;
    private final DuplicateCandidateFinder finder;
    private final MergeExecutor executor;
    private final CandidateCache cache;
    private final AuditService auditService;
    private final MergeLedger mergeLedger;

    private ContactResolver(Builder builder) {
        this.options = builder.options;
        this.ownedConnection = builder.store == null && builder.ownsConnection ? builder.connection : null;

        NormalizationEngine normalizationEngine = builder.normalizationEngine != null
                ? builder.normalizationEngine : DefaultNormalizationRules.createDefaultEngine();
        BlockingKeyStrategy blockingKeyStrategy = builder.blockingKeyStrategy != null
                ? builder.blockingKeyStrategy : new DefaultBlockingKeyStrategy(normalizationEngine);

        if (builder.store != null) {
            this.store = builder.store;
        } else if (builder.connection != null) {
            this.store = new GraphContactStore(builder.connection, blockingKeyStrategy);
            if (builder.createIndexes) {
                builder.connection.createIndexes();
            }
        } else {
            this.store = new InMemoryContactStore(blockingKeyStrategy);
        }

        MetricsService metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        this.auditService = builder.auditService != null ? builder.auditService : new AuditService();
        this.mergeLedger = builder.mergeLedger != null ? builder.mergeLedger : new MergeLedger();

        if (builder.candidateCache != null) {
            this.cache = builder.candidateCache;
        } else if (builder.cacheConfig != null && builder.cacheConfig.enabled()) {
            this.cache = new CaffeineCandidateCache(builder.cacheConfig);
        } else {
            this.cache = new NoOpCandidateCache();
        }

        ContactSimilarityScorer scorer = new ContactSimilarityScorer(
                normalizationEngine, new LevenshteinSimilarity(), options.toScoringWeights());
        this.finder = new DuplicateCandidateFinder(store, scorer, blockingKeyStrategy, cache, metricsService,
                options.getMaxFuzzyCandidates());

        DistributedLock lock = builder.distributedLock != null
                ? builder.distributedLock : new LocalDistributedLock();
        RelationshipMigrator migrator = builder.migrator != null ? builder.migrator : new RelationshipMigrator();
        this.executor = new MergeExecutor(store, new MergeStrategyResolver(), migrator, lock,
                mergeLedger, auditService, metricsService, options.getMaxConflictRetries());

        if (cache instanceof MergeListener mergeListener) {
            executor.addMergeListener(mergeListener);
        }

        log.info("ContactResolver initialized: store={} cache={} maxFuzzyCandidates={}",
                store.getClass().getSimpleName(), cache.getClass().getSimpleName(), options.getMaxFuzzyCandidates());
    }

    // ========== Duplicate discovery ==========

    public List<DuplicateCandidate> findDuplicates(IdentityTuple identity) {
        return finder.findDuplicates(identity);
    }

    /**
     * @param excludeContactId contact left out of the results, typically the one being checked
     */
    public List<DuplicateCandidate> findDuplicates(IdentityTuple identity, String excludeContactId) {
        return finder.findDuplicates(identity, excludeContactId);
    }

    /**
     * Duplicates of an existing contact, excluding the contact itself.
     */
    public List<DuplicateCandidate> findDuplicatesOf(String contactId) {
        Contact contact = requireContact(contactId);
        return finder.findDuplicates(contact.identity(), contact.getId());
    }

    // ========== Merging ==========

    public MergeResult mergeContacts(String primaryId, String secondaryId) {
        return mergeContacts(primaryId, secondaryId, options.getDefaultMergeStrategy(), options.getSourceSystem());
    }

    public MergeResult mergeContacts(String primaryId, String secondaryId, MergeStrategy strategy) {
        return mergeContacts(primaryId, secondaryId, strategy, options.getSourceSystem());
    }

    public MergeResult mergeContacts(String primaryId, String secondaryId, MergeStrategy strategy, String triggeredBy) {
        return executor.merge(primaryId, secondaryId, strategyOrDefault(strategy), triggeredBy);
    }

    public BatchMergeResult mergeBatch(String primaryId, List<String> secondaryIds) {
        return mergeBatch(primaryId, secondaryIds, options.getDefaultMergeStrategy(), options.getSourceSystem());
    }

    public BatchMergeResult mergeBatch(String primaryId, List<String> secondaryIds, MergeStrategy strategy) {
        return mergeBatch(primaryId, secondaryIds, strategy, options.getSourceSystem());
    }

    public BatchMergeResult mergeBatch(String primaryId, List<String> secondaryIds,
                                       MergeStrategy strategy, String triggeredBy) {
        return executor.mergeBatch(primaryId, secondaryIds, strategyOrDefault(strategy), triggeredBy);
    }

    // ========== Contacts ==========

    /**
     * Stores a new contact with phone and WhatsApp numbers normalized to E.164.
     * Cached search results are dropped since any of them may now be missing the new contact.
     */
    public Contact createContact(Contact contact) {
        Contact normalized = Contact.builder(contact)
                .phone(normalizedPhone(contact.getPhone()))
                .whatsapp(normalizedPhone(contact.getWhatsapp()))
                .version(0)
                .build();
        Contact stored = store.save(normalized);
        cache.invalidateAll();
        log.debug("contact.created contactId={}", stored.getId());
        return stored;
    }

    public Optional<Contact> getContact(String contactId) {
        if (contactId == null || contactId.isBlank()) {
            return Optional.empty();
        }
        return store.findById(contactId);
    }

    /**
     * @throws ContactNotFoundException if the contact does not exist
     */
    public RelationshipCounts getRelationshipCounts(String contactId) {
        requireContact(contactId);
        return store.countRelationships(contactId);
    }

    /**
     * Attaches a message, note, scheduled message or analytics event to its contact.
     *
     * @throws ContactNotFoundException if the owning contact does not exist
     */
    public void addRecord(ContactOwnedRecord record) {
        requireContact(record.contactId());
        try {
            store.saveRecord(record);
        } catch (StoreException e) {
            if (store.findById(record.contactId()).isEmpty()) {
                throw new ContactNotFoundException(record.contactId());
            }
            throw e;
        }
    }

    public List<MergeRecord> getMergeHistory(String primaryId) {
        return executor.getMergeHistory(primaryId);
    }

    // ========== Accessors ==========

    public ContactStore getStore() {
        return store;
    }

    public DeduplicationOptions getOptions() {
        return options;
    }

    public AuditService getAuditService() {
        return auditService;
    }

    public MergeLedger getMergeLedger() {
        return mergeLedger;
    }

    public CacheStats getCacheStats() {
        return cache.getStats();
    }

    @Override
    public void close() {
        if (ownedConnection != null) {
            try {
                ownedConnection.close();
            } catch (Exception e) {
                log.warn("Error closing graph connection", e);
            }
        }
    }

    private Contact requireContact(String contactId) {
        if (contactId == null || contactId.isBlank()) {
            throw new ValidationException("contactId is required");
        }
        return store.findById(contactId).orElseThrow(() -> new ContactNotFoundException(contactId));
    }

    private MergeStrategy strategyOrDefault(MergeStrategy strategy) {
        return strategy != null ? strategy : options.getDefaultMergeStrategy();
    }

    private static String normalizedPhone(String phone) {
        String normalized = PhoneNormalizer.normalize(phone);
        return normalized.isEmpty() ? null : normalized;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ContactStore store;
        private GraphConnection connection;
        private boolean ownsConnection = false;
        private boolean createIndexes = true;
        private DeduplicationOptions options = DeduplicationOptions.defaults();
        private NormalizationEngine normalizationEngine;
        private BlockingKeyStrategy blockingKeyStrategy;
        private CacheConfig cacheConfig;
        private CandidateCache candidateCache;
        private DistributedLock distributedLock;
        private MetricsService metricsService;
        private AuditService auditService;
        private MergeLedger mergeLedger;
        private RelationshipMigrator migrator;

        /**
         * Storage to use. Takes precedence over {@link #graphConnection}; defaults to an in-memory store.
         */
        public Builder store(ContactStore store) {
            this.store = store;
            return this;
        }

        public Builder graphConnection(GraphConnection connection) {
            this.connection = connection;
            this.ownsConnection = false;
            return this;
        }

        /**
         * Uses the connection and closes it when the resolver is closed.
         */
        public Builder ownedGraphConnection(GraphConnection connection) {
            this.connection = connection;
            this.ownsConnection = true;
            return this;
        }

        public Builder createIndexes(boolean createIndexes) {
            this.createIndexes = createIndexes;
            return this;
        }

        public Builder options(DeduplicationOptions options) {
            this.options = options != null ? options : DeduplicationOptions.defaults();
            return this;
        }

        public Builder normalizationEngine(NormalizationEngine normalizationEngine) {
            this.normalizationEngine = normalizationEngine;
            return this;
        }

        public Builder blockingKeyStrategy(BlockingKeyStrategy blockingKeyStrategy) {
            this.blockingKeyStrategy = blockingKeyStrategy;
            return this;
        }

        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = cacheConfig;
            return this;
        }

        public Builder candidateCache(CandidateCache candidateCache) {
            this.candidateCache = candidateCache;
            return this;
        }

        public Builder distributedLock(DistributedLock distributedLock) {
            this.distributedLock = distributedLock;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder auditService(AuditService auditService) {
            this.auditService = auditService;
            return this;
        }

        public Builder mergeLedger(MergeLedger mergeLedger) {
            this.mergeLedger = mergeLedger;
            return this;
        }

        public Builder relationshipMigrator(RelationshipMigrator migrator) {
            this.migrator = migrator;
            return this;
        }

        public ContactResolver build() {
            return new ContactResolver(this);
        }
    }
}
