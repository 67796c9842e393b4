package com.shipdata.adapter;

import com.shipdata.error.StoreException;
import com.shipdata.util.DatabaseFamily;
import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

import static com.shipdata.util.SqlIdentifiers.quote;

/**
 * An attached remote database. {@link #close()} detaches it; use with try-with-resources so the
 * detach runs on every exit path.
 */
@Slf4j
public class RemoteAttachment implements AutoCloseable {
    private final Connection connection;
    private final String alias;
    private final DatabaseFamily family;
    private boolean closed;

    public RemoteAttachment(Connection connection, String alias, DatabaseFamily family) {
        this.connection = connection;
        this.alias = alias;
        this.family = family;
    }

    public String getAlias() {
        return alias;
    }

    public DatabaseFamily getFamily() {
        return family;
    }

    /**
     * Fully qualified, quoted reference to a remote table.
     *
     * @param schema remote schema
     * @param table remote table
     * @return {@code alias."schema"."table"}
     */
    public String qualify(String schema, String table) {
        return alias + "." + quote(schema) + "." + quote(table);
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try (Statement st = connection.createStatement()) {
            st.execute("DETACH DATABASE IF EXISTS " + alias);
            log.debug("Detached {} database {}", family.getDisplayName(), alias);
        } catch (SQLException e) {
            throw new StoreException("Failed to detach " + family.getDisplayName() + " database " + alias, e);
        }
    }
}
