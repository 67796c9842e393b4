package com.shipdata.error;

/**
 * Thrown when a referenced file, sheet, row or table does not exist.
 *
 * <p>Messages are safe to surface verbatim to the end user.
 */
public class SourceNotFoundException extends IngestException {
    /**
     * Create a new exception.
     *
     * @param message error message
     */
    public SourceNotFoundException(String message) {
        super("NOT_FOUND", message, null);
    }
}
