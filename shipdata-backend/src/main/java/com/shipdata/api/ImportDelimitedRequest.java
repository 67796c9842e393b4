package com.shipdata.api;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class ImportDelimitedRequest {
    @NotBlank(message = "Session ID is required")
    private String sessionId;

    @NotBlank(message = "Path is required")
    private String path;

    private String delimiter = ",";

    private boolean header = true;

    private String encoding;
}
