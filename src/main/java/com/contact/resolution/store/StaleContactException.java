package com.contact.resolution.store;

/**
 * A version-guarded write found the contact changed or gone since it was read.
 * Nothing from the transaction was applied.
 */
public class StaleContactException extends StoreException {

    private final String contactId;

    public StaleContactException(String contactId) {
        super("Contact was modified concurrently: " + contactId);
        this.contactId = contactId;
    }

    public String getContactId() {
        return contactId;
    }
}
