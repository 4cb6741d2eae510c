package com.contact.resolution.metrics;

import com.contact.resolution.core.model.RecordType;

import java.time.Duration;

public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordMergeDuration(String outcome, Duration duration) {
    }

    @Override
    public void incrementContactsMerged() {
    }

    @Override
    public void recordRecordsMigrated(RecordType type, long count) {
    }

    @Override
    public void incrementMergeConflict() {
    }

    @Override
    public void incrementMergeRetry() {
    }

    @Override
    public void recordBatchSize(int size) {
    }

    @Override
    public void recordSearchDuration(Duration duration) {
    }

    @Override
    public void recordCandidateCount(int count) {
    }

    @Override
    public void recordSimilarityScore(double score) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }
}
