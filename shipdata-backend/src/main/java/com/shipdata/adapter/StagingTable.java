package com.shipdata.adapter;

import com.shipdata.model.SchemaColumn;
import lombok.extern.slf4j.Slf4j;

import java.security.SecureRandom;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;

import static com.shipdata.util.SqlIdentifiers.quote;

/**
 * A private table an import writes into before it replaces the committed DataSource.
 *
 * <p>Closing drops the staging table and every scratch table it handed out, unless
 * {@link #promote(List)} succeeded first. A failed import therefore leaves the committed
 * DataSource exactly as it was.
 */
@Slf4j
public class StagingTable implements AutoCloseable {
    private static final SecureRandom RANDOM = new SecureRandom();

    private final Connection connection;
    private final String name;
    private final List<String> scratchTables = new ArrayList<>();
    private boolean promoted;

    private StagingTable(Connection connection, String name) {
        this.connection = connection;
        this.name = name;
    }

    /**
     * Reserve a staging table name on the session connection. Nothing is created yet.
     *
     * @param connection session connection
     * @return staging handle
     */
    public static StagingTable create(Connection connection) {
        return new StagingTable(connection, "_staging_" + randomHex(6));
    }

    static String randomHex(int bytes) {
        byte[] buf = new byte[bytes];
        RANDOM.nextBytes(buf);
        return HexFormat.of().formatHex(buf);
    }

    public Connection getConnection() {
        return connection;
    }

    public String getName() {
        return name;
    }

    /**
     * Hand out a scratch table name that is dropped when this handle closes.
     *
     * @return unquoted table name
     */
    public String newScratch() {
        String scratch = name + "_s" + scratchTables.size();
        scratchTables.add(scratch);
        return scratch;
    }

    /**
     * Build the staging table from {@code source}: rows whose user columns are all null are
     * removed, then the survivors are numbered 1..N into {@code _row_num}.
     *
     * @param source source table
     * @param sourceColumns user columns of the source, in order
     * @param targetColumns names to give them in the staging table, same size
     * @param orderColumn column giving the load order, or null for scan order
     * @return final and skipped row counts
     * @throws SQLException on store errors
     */
    public FinishedRows finishFrom(String source, List<String> sourceColumns, List<String> targetColumns,
                                   String orderColumn) throws SQLException {
        try (Statement st = connection.createStatement()) {
            long sourceCount = count(st, source);
            if (targetColumns.isEmpty()) {
                st.execute("CREATE TABLE " + quote(name) + " (" + StoreLayout.ROW_NUM + " BIGINT)");
                return new FinishedRows(0, sourceCount);
            }

            List<String> select = new ArrayList<>();
            List<String> nullChecks = new ArrayList<>();
            for (int i = 0; i < sourceColumns.size(); i++) {
                String ref = "src." + quote(sourceColumns.get(i));
                select.add(ref + " AS " + quote(targetColumns.get(i)));
                nullChecks.add(ref + " IS NULL");
            }
            String window = orderColumn != null ? "ORDER BY src." + quote(orderColumn) : "";
            st.execute("CREATE TABLE " + quote(name) + " AS SELECT ROW_NUMBER() OVER (" + window + ") AS "
                    + StoreLayout.ROW_NUM + ", " + String.join(", ", select)
                    + " FROM " + quote(source) + " AS src"
                    + " WHERE NOT (" + String.join(" AND ", nullChecks) + ")"
                    + " ORDER BY " + StoreLayout.ROW_NUM);
            long finalCount = count(st, name);
            return new FinishedRows(finalCount, sourceCount - finalCount);
        }
    }

    /**
     * Columns of the finished staging table with their DuckDB types and nullability.
     *
     * @return user columns in order
     * @throws SQLException on store errors
     */
    public List<StoredColumn> storedColumns() throws SQLException {
        List<StoredColumn> described = new ArrayList<>();
        try (Statement st = connection.createStatement();
             ResultSet rs = st.executeQuery("DESCRIBE " + quote(name))) {
            while (rs.next()) {
                String column = rs.getString("column_name");
                if (!StoreLayout.ROW_NUM.equals(column)) {
                    described.add(new StoredColumn(column, rs.getString("column_type"), false));
                }
            }
        }
        if (described.isEmpty()) {
            return described;
        }

        StringBuilder sql = new StringBuilder("SELECT COUNT(*)");
        for (StoredColumn column : described) {
            sql.append(", COUNT(").append(quote(column.name())).append(')');
        }
        sql.append(" FROM ").append(quote(name));
        List<StoredColumn> out = new ArrayList<>(described.size());
        try (Statement st = connection.createStatement();
             ResultSet rs = st.executeQuery(sql.toString())) {
            rs.next();
            long total = rs.getLong(1);
            for (int i = 0; i < described.size(); i++) {
                StoredColumn column = described.get(i);
                out.add(new StoredColumn(column.name(), column.storageType(), rs.getLong(i + 2) < total));
            }
        }
        return out;
    }

    /**
     * Atomically replace the committed DataSource with this table and rebuild the view without
     * overrides.
     *
     * @param columns schema of the staged rows
     * @throws SQLException on store errors, in which case nothing changed
     */
    public void promote(List<SchemaColumn> columns) throws SQLException {
        boolean autoCommit = connection.getAutoCommit();
        connection.setAutoCommit(false);
        try (Statement st = connection.createStatement()) {
            st.execute("DROP VIEW IF EXISTS " + StoreLayout.VIEW);
            st.execute("DROP TABLE IF EXISTS " + StoreLayout.RAW_TABLE);
            st.execute("ALTER TABLE " + quote(name) + " RENAME TO " + StoreLayout.RAW_TABLE);
            for (String sql : StoreLayout.viewStatements(columns, Map.of())) {
                st.execute(sql);
            }
            connection.commit();
            promoted = true;
        } catch (SQLException e) {
            try {
                connection.rollback();
            } catch (SQLException rollbackFailure) {
                e.addSuppressed(rollbackFailure);
            }
            throw e;
        } finally {
            connection.setAutoCommit(autoCommit);
        }
    }

    private static long count(Statement st, String table) throws SQLException {
        try (ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM " + quote(table))) {
            rs.next();
            return rs.getLong(1);
        }
    }

    @Override
    public void close() {
        List<String> toDrop = new ArrayList<>(scratchTables);
        if (!promoted) {
            toDrop.add(name);
        }
        for (String table : toDrop) {
            try (Statement st = connection.createStatement()) {
                st.execute("DROP TABLE IF EXISTS " + quote(table));
            } catch (SQLException e) {
                // The session database is discarded with the session; log and keep dropping.
                log.warn("Failed to drop staging table {}: {}", table, e.getMessage());
            }
        }
    }

    /**
     * Row counts after the all-null filter.
     *
     * @param rowCount rows kept
     * @param skippedRows rows removed because every column was null
     */
    public record FinishedRows(long rowCount, long skippedRows) {
    }

    /**
     * A user column as stored.
     *
     * @param name column name
     * @param storageType DuckDB type
     * @param nullable true when at least one stored value is null
     */
    public record StoredColumn(String name, String storageType, boolean nullable) {
    }
}
