package com.shipdata.error;

/**
 * Thrown when an ad-hoc statement or filter is refused by the read-only guard. Nothing is
 * executed when this is raised.
 */
public class SqlSecurityException extends IngestException {
    /**
     * Create a new exception.
     *
     * @param message error message
     */
    public SqlSecurityException(String message) {
        super("SECURITY_ERROR", message, "Only a single read-only SELECT against imported_data is allowed.");
    }
}
