package com.contact.resolution.metrics;

import com.contact.resolution.core.model.RecordType;

import java.time.Duration;

/**
 * Metrics hooks for duplicate discovery and merging.
 * {@link NoOpMetricsService} is the default, so the library runs without a metrics backend.
 */
public interface MetricsService {

    /**
     * @param outcome {@code COMPLETED} or the failure's error kind
     */
    void recordMergeDuration(String outcome, Duration duration);

    void incrementContactsMerged();

    void recordRecordsMigrated(RecordType type, long count);

    void incrementMergeConflict();

    void incrementMergeRetry();

    void recordBatchSize(int size);

    void recordSearchDuration(Duration duration);

    void recordCandidateCount(int count);

    void recordSimilarityScore(double score);

    void recordCacheHit();

    void recordCacheMiss();
}
