package com.shipdata.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A table visible through a remote attachment.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RemoteTable {
    private String name;
    /**
     * Null when the remote count failed.
     */
    private Long rowCount;
    private boolean requiresFilter;
}
