package com.contact.resolution.lock;

/**
 * Always succeeds. Merges then rely on the store's version guards alone.
 */
public class NoOpDistributedLock implements DistributedLock {

    @Override
    public boolean tryLock(String key) {
        return true;
    }

    @Override
    public void unlock(String key) {
        // no-op
    }
}
