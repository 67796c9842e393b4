package com.shipdata.api;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class ImportSpreadsheetRequest {
    @NotBlank(message = "Session ID is required")
    private String sessionId;

    @NotBlank(message = "Path is required")
    private String path;

    /**
     * First sheet when omitted.
     */
    private String sheet;

    private boolean header = true;
}
