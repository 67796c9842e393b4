package com.shipdata.api;

import com.shipdata.model.RowData;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FilterResponse {
    private List<RowData> rows;
    private long totalCount;
    private int limit;
    private int offset;
}
