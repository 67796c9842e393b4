package com.shipdata.api;

import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Tabular result of an ad-hoc read-only query.
 */
@Data
public class QueryDataResponse {
    private List<ColumnDefinition> columns;
    private List<Map<String, Object>> rows;
    private Metadata metadata;

    @Data
    public static class ColumnDefinition {
        private String name;
        private String type;
    }

    @Data
    public static class Metadata {
        private boolean truncated;
        private long rowCount;
        private long durationMs;
    }
}
