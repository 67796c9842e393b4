package com.shipdata.error;

/**
 * Thrown for malformed parameters: bad delimiter, unsupported connection scheme, large table
 * without a filter, invalid override type.
 */
public class ValidationException extends IngestException {
    /**
     * Create a new exception.
     *
     * @param message error message
     * @param suggestion how to correct the request
     */
    public ValidationException(String message, String suggestion) {
        super("VALIDATION_ERROR", message, suggestion);
    }
}
