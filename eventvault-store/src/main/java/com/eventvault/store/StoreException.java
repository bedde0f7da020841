package com.eventvault.store;

/**
 * Raised for misuse of the store that no retry can fix: an undeclared
 * resource key, or a lock that could not be acquired in time.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
