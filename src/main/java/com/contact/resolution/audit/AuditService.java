package com.contact.resolution.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Append-only, in-memory audit trail of merges.
 */
public class AuditService {
    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final List<AuditEntry> entries = new CopyOnWriteArrayList<>();

    public AuditEntry record(AuditEntry entry) {
        entries.add(Objects.requireNonNull(entry, "entry is required"));
        log.debug("audit.recorded action={} primaryId={} secondaryId={} actorId={}",
                entry.action(), entry.primaryContactId(), entry.secondaryContactId(), entry.actorId());
        return entry;
    }

    public List<AuditEntry> getAllEntries() {
        return List.copyOf(entries);
    }

    /**
     * Entries where the contact was either the primary or the secondary.
     */
    public List<AuditEntry> getEntriesForContact(String contactId) {
        return entries.stream()
                .filter(e -> e.involves(contactId))
                .toList();
    }

    public List<AuditEntry> getEntriesByAction(AuditAction action) {
        return entries.stream()
                .filter(e -> e.action() == action)
                .toList();
    }

    public int size() {
        return entries.size();
    }
}
