package com.shipdata.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class VerifyChecksumRequest {
    @NotBlank(message = "Session ID is required")
    private String sessionId;

    @NotNull(message = "Row number is required")
    private Long rowNumber;

    @NotBlank(message = "Expected checksum is required")
    private String expectedChecksum;
}
