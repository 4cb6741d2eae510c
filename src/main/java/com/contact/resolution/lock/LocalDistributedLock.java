package com.contact.resolution.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process merge lock for single-JVM deployments.
 *
 * <p>Every merged-away contact id gets its own key, so keys are tracked only while some
 * thread holds or waits for them. The entry is dropped when the last of those threads
 * lets go.</p>
 */
public class LocalDistributedLock implements DistributedLock {
    private static final Logger log = LoggerFactory.getLogger(LocalDistributedLock.class);

    private final ConcurrentHashMap<String, KeyLock> locks = new ConcurrentHashMap<>();
    private final LockConfig config;

    public LocalDistributedLock() {
        this(LockConfig.defaults());
    }

    public LocalDistributedLock(LockConfig config) {
        this.config = config;
    }

    @Override
    public boolean tryLock(String key) {
        KeyLock keyLock = locks.compute(key, (k, existing) -> {
            KeyLock held = existing != null ? existing : new KeyLock();
            held.users++;
            return held;
        });
        boolean acquired = false;
        try {
            acquired = keyLock.lock.tryLock(config.timeoutMs(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockAcquisitionException("Interrupted while acquiring lock for key: " + key, e);
        } finally {
            if (!acquired) {
                release(key);
            }
        }
        if (!acquired) {
            log.warn("lock.timeout key={} timeoutMs={}", key, config.timeoutMs());
            throw new LockAcquisitionException(
                    "Failed to acquire lock for key '" + key + "' within " + config.timeoutMs() + "ms");
        }
        log.debug("lock.acquired key={}", key);
        return true;
    }

    @Override
    public void unlock(String key) {
        KeyLock keyLock = locks.get(key);
        if (keyLock == null || !keyLock.lock.isHeldByCurrentThread()) {
            log.debug("lock.unlockIgnored key={}", key);
            return;
        }
        keyLock.lock.unlock();
        release(key);
        log.debug("lock.released key={}", key);
    }

    public boolean isLocked(String key) {
        KeyLock keyLock = locks.get(key);
        return keyLock != null && keyLock.lock.isLocked();
    }

    /**
     * Number of keys currently held or waited on.
     */
    public int trackedKeys() {
        return locks.size();
    }

    private void release(String key) {
        locks.computeIfPresent(key, (k, keyLock) -> --keyLock.users == 0 ? null : keyLock);
    }

    /**
     * Lock plus the number of threads holding or waiting for it; {@code users} only
     * changes inside the map's per-key compute.
     */
    private static final class KeyLock {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }
}
