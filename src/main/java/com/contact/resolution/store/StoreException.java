package com.contact.resolution.store;

/**
 * Infrastructure failure inside a {@link ContactStore}.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
