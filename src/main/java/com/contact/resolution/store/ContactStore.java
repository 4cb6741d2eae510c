package com.contact.resolution.store;

import com.contact.resolution.core.model.Contact;
import com.contact.resolution.core.model.ContactOwnedRecord;
import com.contact.resolution.core.model.RecordType;
import com.contact.resolution.core.model.RelationshipCounts;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Persistence for contacts and the records they own.
 *
 * <p>Implementations maintain a blocking-key index so duplicate discovery can narrow the
 * population without scanning it, and provide all-or-nothing transactions with
 * version-guarded contact writes.</p>
 */
public interface ContactStore {

    Optional<Contact> findById(String contactId);

    /**
     * Missing ids are skipped.
     */
    List<Contact> findByIds(Collection<String> contactIds);

    /**
     * Ids of contacts indexed under any of the given keys.
     *
     * @param limit maximum number of ids to return; zero or negative means unbounded
     */
    Set<String> findIdsByBlockingKeys(Set<String> keys, int limit);

    RelationshipCounts countRelationships(String contactId);

    List<ContactOwnedRecord> findRecords(String contactId, RecordType type);

    /**
     * Creates or replaces a contact. Replacing is version-guarded like {@link StoreTransaction#update}.
     *
     * @return the stored contact with its new version
     * @throws StaleContactException if the contact changed since it was read
     */
    Contact save(Contact contact);

    /**
     * @throws StoreException if the owning contact does not exist
     */
    void saveRecord(ContactOwnedRecord record);

    /**
     * Runs the callback in a transaction and commits its buffered writes.
     *
     * @throws StaleContactException if a version guard failed at commit
     */
    <T> T inTransaction(TransactionCallback<T> callback);
}
