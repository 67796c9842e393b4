package com.shipdata.model;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Return contract of every adapter import. Produced even when the data raised quality warnings.
 */
@Data
@Builder
public class ImportResult {
    private long rowCount;
    private List<SchemaColumn> columns;
    @Builder.Default
    private List<String> warnings = new ArrayList<>();
    private SourceType sourceType;
    /**
     * Non-secret descriptors of where the data came from (path, sheet, family, host, table).
     */
    @Builder.Default
    private Map<String, String> provenance = new LinkedHashMap<>();
}
