package com.shipdata.error;

/**
 * Thrown when a session id is unknown or its session has expired.
 */
public class SessionExpiredException extends IngestException {
    /**
     * Create a new exception.
     *
     * @param sessionId requested session id
     */
    public SessionExpiredException(String sessionId) {
        super("SESSION_EXPIRED", "Session missing or expired: " + sessionId, "Open a new session and import the data again.");
    }
}
