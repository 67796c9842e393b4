package com.shipdata.adapter;

import com.shipdata.error.StoreException;
import com.shipdata.model.ImportResult;
import com.shipdata.model.SourceMetadata;
import com.shipdata.model.SourceType;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Translates one kind of external source into the uniform staged row representation.
 *
 * @param <P> source specific import parameters
 */
public interface SourceAdapter<P> {

    SourceType sourceType();

    /**
     * Read the source and write the finished, numbered rows into {@code staging}.
     *
     * <p>Implementations never touch the committed DataSource; promotion is the caller's job.
     *
     * @param staging staging handle on the session connection
     * @param parameters source specific parameters
     * @return import result, produced even when the data raised warnings
     * @throws com.shipdata.error.SourceNotFoundException when a file, sheet target or table is missing
     * @throws com.shipdata.error.RemoteConnectionException when a remote host cannot be reached
     * @throws com.shipdata.error.ValidationException for malformed parameters
     */
    ImportResult importData(StagingTable staging, P parameters);

    /**
     * Row count, user column count and source type of the committed DataSource.
     *
     * @param connection session connection
     * @return metadata
     */
    default SourceMetadata getMetadata(Connection connection) {
        try (Statement st = connection.createStatement()) {
            long rows;
            try (ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM " + StoreLayout.RAW_TABLE)) {
                rs.next();
                rows = rs.getLong(1);
            }
            int columns;
            try (ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM duckdb_columns()"
                    + " WHERE database_name = current_database() AND schema_name = 'main'"
                    + " AND table_name = '" + StoreLayout.RAW_TABLE + "'"
                    + " AND column_name <> '" + StoreLayout.ROW_NUM + "'")) {
                rs.next();
                columns = rs.getInt(1);
            }
            return new SourceMetadata(rows, columns, sourceType());
        } catch (SQLException e) {
            throw new StoreException("Failed to read source metadata: " + e.getMessage(), e);
        }
    }
}
