package com.shipdata.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SourceMetadata {
    private long rowCount;
    private int columnCount;
    private SourceType sourceType;
}
