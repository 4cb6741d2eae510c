package com.contact.resolution.discovery;

import com.contact.resolution.cache.CandidateCache;
import com.contact.resolution.cache.NoOpCandidateCache;
import com.contact.resolution.core.exception.ValidationException;
import com.contact.resolution.core.model.Contact;
import com.contact.resolution.core.model.DuplicateCandidate;
import com.contact.resolution.core.model.IdentityTuple;
import com.contact.resolution.logging.LogContext;
import com.contact.resolution.metrics.MetricsService;
import com.contact.resolution.metrics.NoOpMetricsService;
import com.contact.resolution.rules.IdentityField;
import com.contact.resolution.rules.NormalizationEngine;
import com.contact.resolution.rules.PhoneNormalizer;
import com.contact.resolution.similarity.BlockingKeyStrategy;
import com.contact.resolution.similarity.BlockingKeys;
import com.contact.resolution.similarity.ContactSimilarityScorer;
import com.contact.resolution.similarity.SimilarityScore;
import com.contact.resolution.store.ContactStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Finds stored contacts that likely represent the same person as an identity tuple.
 *
 * <p>Candidates are narrowed through the store's blocking-key index before scoring: contacts
 * sharing an exact key (email or phone) are always considered, contacts sharing only a fuzzy
 * name key are capped at {@code maxFuzzyCandidates}. Only pairs the scorer qualifies are
 * returned, ranked by {@link CandidateOrdering#RANKING}.</p>
 *
 * <p>Read-only and safe for concurrent use.</p>
 */
public class DuplicateCandidateFinder {
    private static final Logger log = LoggerFactory.getLogger(DuplicateCandidateFinder.class);

    public static final int DEFAULT_MAX_FUZZY_CANDIDATES = 500;

    private final ContactStore store;
    private final ContactSimilarityScorer scorer;
    private final BlockingKeyStrategy blockingKeyStrategy;
    private final CandidateCache cache;
    private final MetricsService metricsService;
    private final int maxFuzzyCandidates;

    public DuplicateCandidateFinder(ContactStore store,
                                    ContactSimilarityScorer scorer,
                                    BlockingKeyStrategy blockingKeyStrategy) {
        this(store, scorer, blockingKeyStrategy, new NoOpCandidateCache(), new NoOpMetricsService(),
                DEFAULT_MAX_FUZZY_CANDIDATES);
    }

    public DuplicateCandidateFinder(ContactStore store,
                                    ContactSimilarityScorer scorer,
                                    BlockingKeyStrategy blockingKeyStrategy,
                                    CandidateCache cache,
                                    MetricsService metricsService,
                                    int maxFuzzyCandidates) {
        if (maxFuzzyCandidates <= 0) {
            throw new IllegalArgumentException("maxFuzzyCandidates must be > 0");
        }
        this.store = Objects.requireNonNull(store, "store is required");
        this.scorer = Objects.requireNonNull(scorer, "scorer is required");
        this.blockingKeyStrategy = Objects.requireNonNull(blockingKeyStrategy, "blockingKeyStrategy is required");
        this.cache = cache != null ? cache : new NoOpCandidateCache();
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
        this.maxFuzzyCandidates = maxFuzzyCandidates;
    }

    public List<DuplicateCandidate> findDuplicates(IdentityTuple identity) {
        return findDuplicates(identity, null);
    }

    /**
     * @param excludeContactId the contact being checked, left out of its own results; may be null
     * @throws ValidationException if the tuple has no name, email or phone
     */
    public List<DuplicateCandidate> findDuplicates(IdentityTuple identity, String excludeContactId) {
        if (identity == null || !identity.hasIdentifyingField()) {
            throw new ValidationException("At least one of firstName, lastName, email or phone is required");
        }

        try (LogContext ctx = LogContext.forDuplicateSearch(LogContext.generateCorrelationId())) {
            long start = System.nanoTime();
            String searchKey = searchKey(identity, excludeContactId);

            var cached = cache.get(searchKey);
            if (cached.isPresent()) {
                metricsService.recordCacheHit();
                log.debug("duplicates.cacheHit candidates={}", cached.get().size());
                return cached.get();
            }
            metricsService.recordCacheMiss();

            Set<String> candidateIds = lookupCandidateIds(identity);
            if (excludeContactId != null) {
                candidateIds.remove(excludeContactId);
            }

            List<DuplicateCandidate> candidates = new ArrayList<>();
            for (Contact contact : store.findByIds(candidateIds)) {
                SimilarityScore score = scorer.score(identity, contact.identity());
                if (scorer.isDuplicate(score)) {
                    candidates.add(DuplicateCandidate.of(contact, score.score(), score.reasons()));
                    metricsService.recordSimilarityScore(score.score());
                }
            }
            candidates.sort(CandidateOrdering.RANKING);
            List<DuplicateCandidate> result = List.copyOf(candidates);

            cache.put(searchKey, result);
            metricsService.recordCandidateCount(result.size());
            metricsService.recordSearchDuration(Duration.ofNanos(System.nanoTime() - start));
            log.info("duplicates.found scanned={} candidates={} excludeContactId={}",
                    candidateIds.size(), result.size(), excludeContactId);
            return result;
        }
    }

    public int getMaxFuzzyCandidates() {
        return maxFuzzyCandidates;
    }

    private Set<String> lookupCandidateIds(IdentityTuple identity) {
        BlockingKeys keys = blockingKeyStrategy.generateKeys(identity);
        Set<String> ids = new LinkedHashSet<>();
        if (!keys.exactKeys().isEmpty()) {
            ids.addAll(store.findIdsByBlockingKeys(keys.exactKeys(), 0));
        }
        if (!keys.fuzzyKeys().isEmpty()) {
            Set<String> fuzzy = store.findIdsByBlockingKeys(keys.fuzzyKeys(), maxFuzzyCandidates);
            if (fuzzy.size() >= maxFuzzyCandidates) {
                log.debug("duplicates.fuzzyCapReached limit={}", maxFuzzyCandidates);
            }
            ids.addAll(fuzzy);
        }
        return ids;
    }

    private String searchKey(IdentityTuple identity, String excludeContactId) {
        NormalizationEngine engine = scorer.getNormalizationEngine();
        return String.join("|",
                engine.normalize(identity.firstName(), IdentityField.NAME),
                engine.normalize(identity.lastName(), IdentityField.NAME),
                engine.normalize(identity.email(), IdentityField.EMAIL),
                PhoneNormalizer.normalize(identity.phone()),
                engine.normalize(identity.company(), IdentityField.COMPANY),
                excludeContactId != null ? excludeContactId : "");
    }
}
