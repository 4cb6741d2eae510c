package com.contact.resolution.merge;

import com.contact.resolution.audit.AuditEntry;
import com.contact.resolution.audit.AuditService;
import com.contact.resolution.audit.MergeLedger;
import com.contact.resolution.cache.MergeListener;
import com.contact.resolution.core.exception.ContactNotFoundException;
import com.contact.resolution.core.exception.ContactResolutionException;
import com.contact.resolution.core.exception.InvalidMergeException;
import com.contact.resolution.core.exception.MergeConflictException;
import com.contact.resolution.core.exception.MigrationFailureException;
import com.contact.resolution.core.exception.ValidationException;
import com.contact.resolution.core.model.Contact;
import com.contact.resolution.core.model.MergeRecord;
import com.contact.resolution.core.model.RecordType;
import com.contact.resolution.core.model.RelationshipCounts;
import com.contact.resolution.lock.DistributedLock;
import com.contact.resolution.lock.LockAcquisitionException;
import com.contact.resolution.lock.NoOpDistributedLock;
import com.contact.resolution.logging.LogContext;
import com.contact.resolution.metrics.MetricsService;
import com.contact.resolution.metrics.NoOpMetricsService;
import com.contact.resolution.store.ContactStore;
import com.contact.resolution.store.StaleContactException;
import com.contact.resolution.store.StoreTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Merges a secondary contact into a primary.
 *
 * <p>Merge process, one store transaction from step 2 to step 4:</p>
 * <ol>
 *   <li>REQUESTED: ids checked without touching storage</li>
 *   <li>VALIDATED: both contacts re-read inside the transaction</li>
 *   <li>MIGRATING: owned records re-pointed by the {@link RelationshipMigrator}</li>
 *   <li>FINALIZING: resolved fields written to the primary and the secondary deleted,
 *       both guarded by the versions read in step 2</li>
 * </ol>
 *
 * <p>A stale primary re-runs the transaction up to {@code maxConflictRetries} times; a stale or
 * vanished secondary means another merge consumed it and fails with a conflict. Every failure
 * is reported as a {@link ContactResolutionException} carrying the state it failed in.</p>
 */
public class MergeExecutor {
    private static final Logger log = LoggerFactory.getLogger(MergeExecutor.class);

    public static final int DEFAULT_MAX_CONFLICT_RETRIES = 3;
    public static final String DEFAULT_TRIGGERED_BY = "system";

    private final ContactStore store;
    private final MergeStrategyResolver resolver;
    private final RelationshipMigrator migrator;
    private final DistributedLock lock;
    private final MergeLedger mergeLedger;
    private final AuditService auditService;
    private final MetricsService metricsService;
    private final int maxConflictRetries;
    private final List<MergeListener> mergeListeners = new CopyOnWriteArrayList<>();

    public MergeExecutor(ContactStore store) {
        this(store, new MergeStrategyResolver(), new RelationshipMigrator(), new NoOpDistributedLock(),
                new MergeLedger(), new AuditService(), new NoOpMetricsService(), DEFAULT_MAX_CONFLICT_RETRIES);
    }

    public MergeExecutor(ContactStore store,
                         MergeStrategyResolver resolver,
                         RelationshipMigrator migrator,
                         DistributedLock lock,
                         MergeLedger mergeLedger,
                         AuditService auditService,
                         MetricsService metricsService,
                         int maxConflictRetries) {
        if (maxConflictRetries < 0) {
            throw new IllegalArgumentException("maxConflictRetries must be >= 0");
        }
        this.store = Objects.requireNonNull(store, "store is required");
        this.resolver = Objects.requireNonNull(resolver, "resolver is required");
        this.migrator = Objects.requireNonNull(migrator, "migrator is required");
        this.lock = lock != null ? lock : new NoOpDistributedLock();
        this.mergeLedger = mergeLedger != null ? mergeLedger : new MergeLedger();
        this.auditService = auditService != null ? auditService : new AuditService();
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
        this.maxConflictRetries = maxConflictRetries;
    }

    public void addMergeListener(MergeListener listener) {
        mergeListeners.add(Objects.requireNonNull(listener, "listener is required"));
    }

    public void removeMergeListener(MergeListener listener) {
        mergeListeners.remove(listener);
    }

    public MergeResult merge(String primaryId, String secondaryId) {
        return merge(primaryId, secondaryId, MergeStrategy.defaults(), DEFAULT_TRIGGERED_BY);
    }

    /**
     * Merges {@code secondaryId} into {@code primaryId}. On success the secondary no longer
     * exists and the primary owns every record either contact owned before.
     *
     * @throws ValidationException        if an id is blank
     * @throws InvalidMergeException      if both ids are the same
     * @throws ContactNotFoundException   if either contact does not exist
     * @throws MergeConflictException     if a concurrent merge got to the secondary first
     * @throws MigrationFailureException  if storage failed; nothing was applied
     */
    public MergeResult merge(String primaryId, String secondaryId, MergeStrategy strategy, String triggeredBy) {
        if (isBlank(primaryId) || isBlank(secondaryId)) {
            throw new ValidationException("primaryId and secondaryId are required", MergeState.REQUESTED);
        }
        if (primaryId.equals(secondaryId)) {
            throw new InvalidMergeException("Cannot merge a contact into itself: " + primaryId);
        }
        MergeStrategy effective = strategy != null ? strategy : MergeStrategy.defaults();
        String actor = isBlank(triggeredBy) ? DEFAULT_TRIGGERED_BY : triggeredBy;

        try (LogContext logCtx = LogContext.forMerge(LogContext.generateCorrelationId(), primaryId, secondaryId)) {
            log.info("merge.starting primaryId={} secondaryId={} triggeredBy={} strategy={}",
                    primaryId, secondaryId, actor, effective);
            long start = System.nanoTime();
            String lockKey = DistributedLock.mergeKey(secondaryId);
            boolean locked = false;
            try {
                try {
                    locked = lock.tryLock(lockKey);
                } catch (LockAcquisitionException e) {
                    metricsService.incrementMergeConflict();
                    throw new MergeConflictException(
                            "Another merge is in progress for contact " + secondaryId, MergeState.REQUESTED, e);
                }

                MergeResult result = executeWithRetries(primaryId, secondaryId, effective, actor);

                metricsService.recordMergeDuration(MergeState.COMPLETED.name(), elapsed(start));
                log.info("merge.completed primaryId={} secondaryId={} migrated={} attempts={}",
                        primaryId, secondaryId, result.migrated().total(), result.attempts());
                notifyMergeListeners(primaryId, secondaryId);
                return result;
            } catch (ContactResolutionException e) {
                metricsService.recordMergeDuration(e.getKind().name(), elapsed(start));
                auditService.record(AuditEntry.mergeFailed(primaryId, secondaryId, actor, e.getKind(),
                        e.getFailedState().orElse(MergeState.REQUESTED), e.getMessage()));
                log.warn("merge.failed primaryId={} secondaryId={} kind={} state={} error={}",
                        primaryId, secondaryId, e.getKind(), e.getFailedState().orElse(null), e.getMessage());
                throw e;
            } finally {
                if (locked) {
                    lock.unlock(lockKey);
                }
            }
        }
    }

    /**
     * Merges each secondary into the primary in order, stopping at the first failure.
     * Earlier merges are not rolled back.
     *
     * @throws ValidationException if the primary id is blank or the list is missing
     */
    public BatchMergeResult mergeBatch(String primaryId, List<String> secondaryIds,
                                       MergeStrategy strategy, String triggeredBy) {
        if (isBlank(primaryId)) {
            throw new ValidationException("primaryId is required", MergeState.REQUESTED);
        }
        if (secondaryIds == null) {
            throw new ValidationException("secondaryIds are required", MergeState.REQUESTED);
        }

        String batchId = LogContext.generateCorrelationId();
        try (LogContext logCtx = LogContext.forBatch(batchId, primaryId)) {
            log.info("batchMerge.starting primaryId={} secondaries={}", primaryId, secondaryIds.size());
            metricsService.recordBatchSize(secondaryIds.size());

            List<String> merged = new ArrayList<>();
            Contact latest = null;
            for (int i = 0; i < secondaryIds.size(); i++) {
                String secondaryId = secondaryIds.get(i);
                try {
                    latest = merge(primaryId, secondaryId, strategy, triggeredBy).primary();
                    merged.add(secondaryId);
                } catch (ContactResolutionException e) {
                    List<String> notAttempted = secondaryIds.subList(i + 1, secondaryIds.size());
                    auditService.record(AuditEntry.batchStopped(batchId, primaryId, secondaryId, triggeredBy,
                            e.getKind(), merged.size(), notAttempted.size()));
                    log.warn("batchMerge.stopped primaryId={} failedId={} kind={} merged={} notAttempted={}",
                            primaryId, secondaryId, e.getKind(), merged.size(), notAttempted.size());
                    Contact primary = store.findById(primaryId).orElse(latest);
                    return new BatchMergeResult(primaryId, merged, secondaryId, e.getKind(), e.getMessage(),
                            notAttempted, primary, countsFor(primary));
                }
            }

            log.info("batchMerge.completed primaryId={} merged={}", primaryId, merged.size());
            Contact primary = store.findById(primaryId).orElse(latest);
            return new BatchMergeResult(primaryId, merged, null, null, null, List.of(), primary, countsFor(primary));
        }
    }

    public List<MergeRecord> getMergeHistory(String primaryId) {
        return mergeLedger.getRecordsForPrimary(primaryId);
    }

    public MergeLedger getMergeLedger() {
        return mergeLedger;
    }

    private MergeResult executeWithRetries(String primaryId, String secondaryId,
                                           MergeStrategy strategy, String triggeredBy) {
        for (int attempt = 1; ; attempt++) {
            MergeAttempt progress = new MergeAttempt();
            try {
                Committed committed = store.inTransaction(tx -> {
                    Contact primary = tx.findById(primaryId)
                            .orElseThrow(() -> new ContactNotFoundException(primaryId, MergeState.VALIDATED));
                    Contact secondary = tx.findById(secondaryId)
                            .orElseThrow(() -> new ContactNotFoundException(secondaryId, MergeState.VALIDATED));
                    progress.state = MergeState.MIGRATING;

                    migrator.migrate(tx, secondaryId, primaryId);
                    progress.state = MergeState.FINALIZING;

                    MergePlan plan = resolver.resolve(primary, secondary, strategy);
                    tx.update(plan.resolvedPrimary());
                    tx.delete(secondaryId, secondary.getVersion());
                    return new Committed(plan, secondary, tx);
                });
                return complete(primaryId, committed, triggeredBy, attempt);
            } catch (StaleContactException e) {
                metricsService.incrementMergeConflict();
                if (secondaryId.equals(e.getContactId())) {
                    throw new MergeConflictException(
                            "Contact " + secondaryId + " was changed or merged concurrently", MergeState.FINALIZING, e);
                }
                if (attempt > maxConflictRetries) {
                    throw new MergeConflictException("Contact " + primaryId + " kept changing after "
                            + attempt + " attempts", MergeState.FINALIZING, e);
                }
                metricsService.incrementMergeRetry();
                log.info("merge.retrying primaryId={} secondaryId={} attempt={}", primaryId, secondaryId, attempt);
            } catch (ContactResolutionException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new MigrationFailureException("Storage failure while merging " + secondaryId
                        + " into " + primaryId + ": " + e.getMessage(), progress.state, e);
            }
        }
    }

    private MergeResult complete(String primaryId, Committed committed, String triggeredBy, int attempts) {
        Contact secondary = committed.secondary();
        MergePlan plan = committed.plan();
        RelationshipCounts migrated = committed.transaction().reassigned();

        for (RecordType type : RecordType.values()) {
            long moved = migrated.get(type);
            if (moved > 0) {
                metricsService.recordRecordsMigrated(type, moved);
            }
        }
        metricsService.incrementContactsMerged();

        MergeRecord record = mergeLedger.record(MergeRecord.builder()
                .primaryContactId(primaryId)
                .secondaryContactId(secondary.getId())
                .secondaryDisplayName(secondary.getDisplayName())
                .migrated(migrated)
                .fieldSources(plan.provenance())
                .triggeredBy(triggeredBy)
                .build());

        auditService.record(AuditEntry.relationshipsMigrated(primaryId, secondary.getId(), triggeredBy, migrated));
        auditService.record(AuditEntry.contactMerged(primaryId, secondary.getId(), triggeredBy, record.id()));

        Contact primary = store.findById(primaryId).orElse(plan.resolvedPrimary());
        return new MergeResult(primary, store.countRelationships(primaryId), migrated,
                plan.fieldSources(), record, attempts);
    }

    private RelationshipCounts countsFor(Contact primary) {
        return primary != null ? store.countRelationships(primary.getId()) : RelationshipCounts.empty();
    }

    private void notifyMergeListeners(String primaryId, String secondaryId) {
        for (MergeListener listener : mergeListeners) {
            try {
                listener.onMerge(primaryId, secondaryId);
            } catch (RuntimeException e) {
                log.warn("merge.listenerFailed listener={} error={}", listener.getClass().getSimpleName(), e.getMessage());
            }
        }
    }

    private static Duration elapsed(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static final class MergeAttempt {
        private MergeState state = MergeState.VALIDATED;
    }

    private record Committed(MergePlan plan, Contact secondary, StoreTransaction transaction) {
    }
}
