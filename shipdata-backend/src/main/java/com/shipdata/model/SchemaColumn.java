package com.shipdata.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One schema entry of the active DataSource.
 *
 * <p>Immutable after import in spirit: only the response copy produced by the schema service
 * carries {@code typeOverride}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SchemaColumn {
    private String name;
    private ColumnType type;
    private String storageType;
    private boolean nullable;
    @Builder.Default
    private List<String> warnings = new ArrayList<>();
    private ColumnType typeOverride;
}
