package com.contact.resolution.metrics;

import com.contact.resolution.core.model.RecordType;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class MetricsServiceTest {

    @Nested
    @DisplayName("NoOpMetricsService")
    class NoOpTests {

        @Test
        @DisplayName("All methods should be callable without errors")
        void testNoOp() {
            NoOpMetricsService service = new NoOpMetricsService();
            assertDoesNotThrow(() -> {
                service.recordMergeDuration("success", Duration.ofMillis(10));
                service.incrementContactsMerged();
                service.recordRecordsMigrated(RecordType.MESSAGE, 3);
                service.incrementMergeConflict();
                service.incrementMergeRetry();
                service.recordBatchSize(2);
                service.recordSearchDuration(Duration.ofMillis(5));
                service.recordCandidateCount(4);
                service.recordSimilarityScore(0.9);
                service.recordCacheHit();
                service.recordCacheMiss();
            });
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private SimpleMeterRegistry registry;
        private MicrometerMetricsService service;

        @BeforeEach
        void setUp() {
            registry = new SimpleMeterRegistry();
            service = new MicrometerMetricsService(registry);
        }

        @Test
        @DisplayName("Merge counters")
        void testMergeCounters() {
            service.incrementContactsMerged();
            service.incrementContactsMerged();
            service.incrementMergeConflict();
            service.incrementMergeRetry();

            assertEquals(2.0, registry.counter("contact.merged").count());
            assertEquals(1.0, registry.counter("contact.merge.conflict").count());
            assertEquals(1.0, registry.counter("contact.merge.retry").count());
        }

        @Test
        @DisplayName("Merge duration is tagged by outcome")
        void testMergeDuration() {
            service.recordMergeDuration("success", Duration.ofMillis(20));
            service.recordMergeDuration("success", Duration.ofMillis(30));
            service.recordMergeDuration("conflict", Duration.ofMillis(5));

            assertEquals(2, registry.get("contact.merge.duration").tag("outcome", "success").timer().count());
            assertEquals(1, registry.get("contact.merge.duration").tag("outcome", "conflict").timer().count());
        }

        @Test
        @DisplayName("Migrated records are counted per record type")
        void testRecordsMigrated() {
            service.recordRecordsMigrated(RecordType.MESSAGE, 5);
            service.recordRecordsMigrated(RecordType.MESSAGE, 2);
            service.recordRecordsMigrated(RecordType.NOTE, 1);

            assertEquals(7.0, registry.get("contact.records.migrated").tag("recordType", "Message").counter().count());
            assertEquals(1.0, registry.get("contact.records.migrated").tag("recordType", "Note").counter().count());
        }

        @Test
        @DisplayName("Search metrics")
        void testSearchMetrics() {
            service.recordSearchDuration(Duration.ofMillis(12));
            service.recordCandidateCount(3);
            service.recordSimilarityScore(0.75);
            service.recordCacheHit();
            service.recordCacheMiss();
            service.recordCacheMiss();

            assertEquals(1, registry.get("contact.duplicates.search.duration").timer().count());
            assertEquals(3.0, registry.get("contact.duplicates.candidates").summary().totalAmount());
            assertEquals(0.75, registry.get("contact.similarity.score").summary().totalAmount(), 0.0001);
            assertEquals(1.0, registry.counter("contact.cache.hit").count());
            assertEquals(2.0, registry.counter("contact.cache.miss").count());
        }

        @Test
        @DisplayName("Batch size summary")
        void testBatchSize() {
            service.recordBatchSize(4);
            service.recordBatchSize(2);

            assertEquals(2, registry.get("contact.merge.batch.size").summary().count());
            assertEquals(6.0, registry.get("contact.merge.batch.size").summary().totalAmount());
        }
    }
}
