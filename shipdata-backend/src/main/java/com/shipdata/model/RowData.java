package com.shipdata.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RowData {
    private long rowNumber;
    private Map<String, Object> data;
    private String checksum;
}
