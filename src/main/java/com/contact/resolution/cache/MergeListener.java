package com.contact.resolution.cache;

/**
 * Notified after a merge has committed.
 */
public interface MergeListener {

    /**
     * @param primaryContactId   the surviving contact
     * @param secondaryContactId the contact that was merged in and deleted
     */
    void onMerge(String primaryContactId, String secondaryContactId);
}
