package com.contact.resolution.audit;

import com.contact.resolution.core.model.MergeRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Append-only ledger of completed merges. Records are never modified or removed.
 */
public class MergeLedger {
    private static final Logger log = LoggerFactory.getLogger(MergeLedger.class);

    private final List<MergeRecord> records = new CopyOnWriteArrayList<>();

    public MergeRecord record(MergeRecord mergeRecord) {
        records.add(mergeRecord);
        log.info("ledger.mergeRecorded primaryId={} secondaryId={} migrated={} triggeredBy={}",
                mergeRecord.primaryContactId(),
                mergeRecord.secondaryContactId(),
                mergeRecord.migrated().total(),
                mergeRecord.triggeredBy());
        return mergeRecord;
    }

    public List<MergeRecord> getAllRecords() {
        return Collections.unmodifiableList(new ArrayList<>(records));
    }

    /**
     * Merges into the given primary, oldest first.
     */
    public List<MergeRecord> getRecordsForPrimary(String primaryContactId) {
        return records.stream()
                .filter(r -> r.primaryContactId().equals(primaryContactId))
                .toList();
    }

    public List<MergeRecord> getRecordsForSecondary(String secondaryContactId) {
        return records.stream()
                .filter(r -> r.secondaryContactId().equals(secondaryContactId))
                .toList();
    }

    /**
     * Every contact absorbed into the given one, directly or through earlier merges.
     */
    public List<String> getMergeChain(String contactId) {
        List<String> chain = new ArrayList<>();
        collectMergeChain(contactId, chain);
        return chain;
    }

    public int size() {
        return records.size();
    }

    private void collectMergeChain(String contactId, List<String> chain) {
        for (MergeRecord record : getRecordsForPrimary(contactId)) {
            if (!chain.contains(record.secondaryContactId())) {
                chain.add(record.secondaryContactId());
                collectMergeChain(record.secondaryContactId(), chain);
            }
        }
    }
}
