package com.shipdata.adapter;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DelimitedImportParameters {
    String path;
    /**
     * Single character, {@code \t} or {@code tab}. Defaults to a comma.
     */
    @Builder.Default
    String delimiter = ",";
    @Builder.Default
    boolean header = true;
    /**
     * Charset name, defaults to UTF-8.
     */
    String encoding;
}
