package com.contact.resolution.lock;

/**
 * Mutual exclusion for merges that touch the same contact.
 * The merge executor locks on the secondary contact so two merges cannot both consume it.
 */
public interface DistributedLock {

    /**
     * Acquires the lock for the key, waiting up to the configured timeout.
     *
     * @return true once the lock is held
     * @throws LockAcquisitionException if the lock could not be acquired in time
     */
    boolean tryLock(String key);

    /**
     * Releases the lock if the current caller holds it.
     */
    void unlock(String key);

    static String mergeKey(String secondaryContactId) {
        return "merge:secondary:" + secondaryContactId;
    }
}
