package com.shipdata.api;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import lombok.ToString;

@Data
public class ImportDatabaseRequest {
    @NotBlank(message = "Session ID is required")
    private String sessionId;

    @ToString.Exclude
    @NotBlank(message = "Connection string is required")
    private String connectionString;

    private String schema;

    @NotBlank(message = "Table is required")
    private String table;

    /**
     * Optional row filter, the condition that follows WHERE.
     */
    private String filter;
}
