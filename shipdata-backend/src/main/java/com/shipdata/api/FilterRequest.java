package com.shipdata.api;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class FilterRequest {
    @NotBlank(message = "Session ID is required")
    private String sessionId;

    /**
     * Boolean condition over column names; blank selects every row.
     */
    private String predicate;

    private int limit = 100;

    private int offset = 0;
}
