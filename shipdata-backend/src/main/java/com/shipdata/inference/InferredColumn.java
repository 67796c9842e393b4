package com.shipdata.inference;

import com.shipdata.model.ColumnType;
import lombok.Value;

import java.util.List;

/**
 * Outcome of a full-column type scan.
 */
@Value
public class InferredColumn {
    String name;
    ColumnType type;
    DateOrder dateOrder;
    List<String> warnings;
}
