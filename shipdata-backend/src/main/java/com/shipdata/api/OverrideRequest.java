package com.shipdata.api;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class OverrideRequest {
    @NotBlank(message = "Session ID is required")
    private String sessionId;

    @NotBlank(message = "Column is required")
    private String column;

    @NotBlank(message = "Type is required")
    private String type;
}
