package com.shipdata.model;

import lombok.Builder;
import lombok.Data;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

/**
 * The single active imported dataset of a session.
 */
@Data
@Builder
public class DataSourceInfo {
    private SourceType sourceType;
    private long rowCount;
    private int columnCount;
    private OffsetDateTime createdAt;
    private List<SchemaColumn> columns;
    private Map<String, String> provenance;
}
