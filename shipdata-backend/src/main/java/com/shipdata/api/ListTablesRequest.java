package com.shipdata.api;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import lombok.ToString;

/**
 * Sent as a POST body so the connection string never lands in a URL or access log.
 */
@Data
public class ListTablesRequest {
    @NotBlank(message = "Session ID is required")
    private String sessionId;

    @ToString.Exclude
    @NotBlank(message = "Connection string is required")
    private String connectionString;

    private String schema;
}
