package com.shipdata.api;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChecksumVerifyResponse {
    private long rowNumber;
    private boolean matches;
    private String expectedChecksum;
    private String actualChecksum;
}
