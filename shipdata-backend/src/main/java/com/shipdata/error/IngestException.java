package com.shipdata.error;

/**
 * Base type for failures the ingestion engine reports to its callers.
 *
 * <p>Every subtype carries a stable {@code code} used by the REST layer and, where one exists,
 * a corrective suggestion that is safe to show to the end user.
 */
public abstract class IngestException extends RuntimeException {
    private final String code;
    private final String suggestion;

    /**
     * Create a new exception.
     *
     * @param code stable error code
     * @param message error message
     * @param suggestion corrective suggestion, may be null
     */
    protected IngestException(String code, String message, String suggestion) {
        super(message);
        this.code = code;
        this.suggestion = suggestion;
    }

    /**
     * Create a new exception with a cause.
     *
     * @param code stable error code
     * @param message error message
     * @param suggestion corrective suggestion, may be null
     * @param cause underlying cause
     */
    protected IngestException(String code, String message, String suggestion, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.suggestion = suggestion;
    }

    public String getCode() {
        return code;
    }

    public String getSuggestion() {
        return suggestion;
    }
}
