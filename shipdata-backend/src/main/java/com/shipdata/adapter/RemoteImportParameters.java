package com.shipdata.adapter;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

/**
 * Parameters of a remote snapshot import.
 */
@Value
@Builder
public class RemoteImportParameters {
    /**
     * Carries credentials. Excluded from {@code toString()}; never log this field.
     */
    @ToString.Exclude
    String connectionString;
    /**
     * Defaults to {@code public} on Postgres and the database name on MySQL.
     */
    String schema;
    String table;
    /**
     * Optional row filter, the text after {@code WHERE}.
     */
    String filter;
}
