package com.contact.resolution.core.exception;

import com.contact.resolution.merge.MergeState;

public class ContactNotFoundException extends ContactResolutionException {

    private final String contactId;

    public ContactNotFoundException(String contactId) {
        this(contactId, null);
    }

    public ContactNotFoundException(String contactId, MergeState failedState) {
        super(ErrorKind.NOT_FOUND, "Contact not found: " + contactId, failedState, null);
        this.contactId = contactId;
    }

    public String getContactId() {
        return contactId;
    }
}
