package com.shipdata.api;

import com.shipdata.model.ColumnType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OverrideResponse {
    private String column;
    private ColumnType originalType;
    private ColumnType newType;
    /**
     * Non-null stored values the cast turns into null.
     */
    private long unconvertibleValues;
    @Builder.Default
    private List<String> warnings = new ArrayList<>();
}
