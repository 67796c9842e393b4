package com.shipdata.api;

import com.shipdata.model.RowChecksum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChecksumsResponse {
    private long startRow;
    private long endRow;
    private List<RowChecksum> checksums;
}
