package com.shipdata.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.shipdata.model.SchemaColumn;
import com.shipdata.model.SourceType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

/**
 * The active DataSource, or just {@code active=false} when nothing is imported.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SourceInfoResponse {
    private boolean active;
    private SourceType sourceType;
    private Map<String, String> provenance;
    private Long rowCount;
    private Integer columnCount;
    private OffsetDateTime createdAt;
    private List<SchemaColumn> columns;
    /**
     * SHA-256 over column names, storage types and nullability.
     */
    private String signature;
}
