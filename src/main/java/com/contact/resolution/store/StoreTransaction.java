package com.contact.resolution.store;

import com.contact.resolution.core.model.Contact;
import com.contact.resolution.core.model.RecordType;
import com.contact.resolution.core.model.RelationshipCounts;

import java.util.Optional;

/**
 * Unit of work handed to a {@link TransactionCallback}.
 *
 * <p>Writes are buffered and become visible together when the callback returns normally.
 * If the callback throws, or a version guard fails at commit, none of them are applied.</p>
 */
public interface StoreTransaction {

    Optional<Contact> findById(String contactId);

    /**
     * Re-points every record of the given type from one contact to another. The records are
     * selected at commit, so a record added to {@code fromContactId} in the meantime moves too.
     */
    void reassignRecords(RecordType type, String fromContactId, String toContactId);

    /**
     * Records moved by this transaction's reassignments, per type. Empty until the transaction
     * has committed.
     */
    RelationshipCounts reassigned();

    /**
     * Replaces a contact. The write only commits if the stored version still equals
     * {@code contact.getVersion()}.
     */
    void update(Contact contact);

    /**
     * Deletes a contact if its stored version still equals {@code expectedVersion}.
     */
    void delete(String contactId, long expectedVersion);
}
