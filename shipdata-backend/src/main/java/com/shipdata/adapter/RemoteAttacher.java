package com.shipdata.adapter;

import com.shipdata.util.ConnectionStringParser.ParsedConnectionString;

import java.sql.Connection;

/**
 * Attaches a remote database to a session connection, read-only, under a private alias.
 */
public interface RemoteAttacher {

    /**
     * Attach {@code target}. The returned attachment must be closed to detach.
     *
     * @param connection session connection
     * @param target parsed connection string
     * @return open attachment
     * @throws com.shipdata.error.RemoteConnectionException when the database cannot be attached
     */
    RemoteAttachment attach(Connection connection, ParsedConnectionString target);
}
