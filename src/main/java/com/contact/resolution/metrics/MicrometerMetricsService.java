package com.contact.resolution.metrics;

import com.contact.resolution.core.model.RecordType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code contact.merge.duration}: Timer (tag: outcome)</li>
 *   <li>{@code contact.merged}: Counter</li>
 *   <li>{@code contact.records.migrated}: Counter (tag: recordType)</li>
 *   <li>{@code contact.merge.conflict}: Counter</li>
 *   <li>{@code contact.merge.retry}: Counter</li>
 *   <li>{@code contact.merge.batch.size}: DistributionSummary</li>
 *   <li>{@code contact.duplicates.search.duration}: Timer</li>
 *   <li>{@code contact.duplicates.candidates}: DistributionSummary</li>
 *   <li>{@code contact.similarity.score}: DistributionSummary</li>
 *   <li>{@code contact.cache.hit} and {@code contact.cache.miss}: Counters</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> mergeTimers = new ConcurrentHashMap<>();
    private final Map<RecordType, Counter> migratedCounters = new ConcurrentHashMap<>();
    private final Counter mergedCounter;
    private final Counter conflictCounter;
    private final Counter retryCounter;
    private final DistributionSummary batchSizeSummary;
    private final Timer searchTimer;
    private final DistributionSummary candidateCountSummary;
    private final DistributionSummary similarityScoreSummary;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.mergedCounter = Counter.builder("contact.merged")
                .description("Number of contacts merged into another contact")
                .register(registry);
        this.conflictCounter = Counter.builder("contact.merge.conflict")
                .description("Merges rejected because a contact changed concurrently")
                .register(registry);
        this.retryCounter = Counter.builder("contact.merge.retry")
                .description("Merge transactions re-run after a stale primary")
                .register(registry);
        this.batchSizeSummary = DistributionSummary.builder("contact.merge.batch.size")
                .description("Number of secondaries per batch merge request")
                .register(registry);
        this.searchTimer = Timer.builder("contact.duplicates.search.duration")
                .description("Duration of duplicate searches")
                .register(registry);
        this.candidateCountSummary = DistributionSummary.builder("contact.duplicates.candidates")
                .description("Number of qualifying candidates per duplicate search")
                .register(registry);
        this.similarityScoreSummary = DistributionSummary.builder("contact.similarity.score")
                .description("Scores of qualifying duplicate candidates")
                .register(registry);
        this.cacheHitCounter = Counter.builder("contact.cache.hit")
                .description("Duplicate searches answered from cache")
                .register(registry);
        this.cacheMissCounter = Counter.builder("contact.cache.miss")
                .description("Duplicate searches not found in cache")
                .register(registry);
    }

    @Override
    public void recordMergeDuration(String outcome, Duration duration) {
        Timer timer = mergeTimers.computeIfAbsent(outcome, k ->
                Timer.builder("contact.merge.duration")
                        .description("Duration of contact merges")
                        .tag("outcome", outcome)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementContactsMerged() {
        mergedCounter.increment();
    }

    @Override
    public void recordRecordsMigrated(RecordType type, long count) {
        Counter counter = migratedCounters.computeIfAbsent(type, t ->
                Counter.builder("contact.records.migrated")
                        .description("Owned records re-pointed to a surviving contact")
                        .tag("recordType", t.label())
                        .register(registry));
        counter.increment(count);
    }

    @Override
    public void incrementMergeConflict() {
        conflictCounter.increment();
    }

    @Override
    public void incrementMergeRetry() {
        retryCounter.increment();
    }

    @Override
    public void recordBatchSize(int size) {
        batchSizeSummary.record(size);
    }

    @Override
    public void recordSearchDuration(Duration duration) {
        searchTimer.record(duration);
    }

    @Override
    public void recordCandidateCount(int count) {
        candidateCountSummary.record(count);
    }

    @Override
    public void recordSimilarityScore(double score) {
        similarityScoreSummary.record(score);
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }
}
