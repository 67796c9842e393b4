package com.shipdata.error;

/**
 * Wraps an unexpected failure of the local analytical store. Not retried.
 */
public class StoreException extends IngestException {
    /**
     * Create a new exception.
     *
     * @param message error message
     * @param cause underlying cause
     */
    public StoreException(String message, Throwable cause) {
        super("STORE_ERROR", message, null, cause);
    }
}
