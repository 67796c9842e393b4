package com.shipdata.api;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class ImportFileRequest {
    @NotBlank(message = "Session ID is required")
    private String sessionId;

    @NotBlank(message = "Path is required")
    private String path;
}
