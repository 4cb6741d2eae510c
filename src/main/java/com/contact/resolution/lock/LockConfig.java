package com.contact.resolution.lock;

/**
 * @param timeoutMs maximum time to wait for a lock
 */
public record LockConfig(long timeoutMs) {

    public LockConfig {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be > 0");
        }
    }

    /**
     * 5 second timeout.
     */
    public static LockConfig defaults() {
        return new LockConfig(5000);
    }
}
