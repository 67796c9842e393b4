package com.shipdata.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of external source a DataSource was imported from.
 */
public enum SourceType {
    DELIMITED_FILE("delimited-file"),
    SPREADSHEET("spreadsheet"),
    REMOTE_DATABASE("remote-database");

    private final String wireName;

    SourceType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
