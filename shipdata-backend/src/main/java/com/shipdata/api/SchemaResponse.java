package com.shipdata.api;

import com.shipdata.model.SchemaColumn;
import com.shipdata.model.SourceType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SchemaResponse {
    private SourceType sourceType;
    private long rowCount;
    private List<SchemaColumn> columns;
    /**
     * Active overrides, column name to type wire name.
     */
    private Map<String, String> overrides;
}
