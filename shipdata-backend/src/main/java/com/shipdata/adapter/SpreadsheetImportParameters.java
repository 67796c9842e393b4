package com.shipdata.adapter;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SpreadsheetImportParameters {
    String path;
    /**
     * Sheet name; the first sheet when null or blank.
     */
    String sheet;
    @Builder.Default
    boolean header = true;
}
