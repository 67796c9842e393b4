package com.shipdata.api;

import com.shipdata.model.RemoteTable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TablesResponse {
    private long threshold;
    private List<RemoteTable> tables;
}
