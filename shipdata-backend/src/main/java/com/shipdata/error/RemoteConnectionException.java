package com.shipdata.error;

/**
 * Thrown when a remote database cannot be reached or rejects the credentials.
 *
 * <p>The message names the database family and host only. Callers must never pass the raw
 * connection string or a driver message that may contain it.
 */
public class RemoteConnectionException extends IngestException {
    private final String family;

    /**
     * Create a new exception.
     *
     * @param family database family, e.g. {@code postgres}
     * @param message scrubbed error message
     */
    public RemoteConnectionException(String family, String message) {
        super("CONNECTION_ERROR", message, "Check that the " + family + " host is reachable and the credentials are valid.");
        this.family = family;
    }

    public String getFamily() {
        return family;
    }
}
