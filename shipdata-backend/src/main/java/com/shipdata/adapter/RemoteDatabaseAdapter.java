package com.shipdata.adapter;

import com.shipdata.error.RemoteConnectionException;
import com.shipdata.error.SourceNotFoundException;
import com.shipdata.error.StoreException;
import com.shipdata.error.ValidationException;
import com.shipdata.model.ColumnType;
import com.shipdata.model.ImportResult;
import com.shipdata.model.RemoteTable;
import com.shipdata.model.SchemaColumn;
import com.shipdata.model.SourceType;
import com.shipdata.util.ConnectionStringParser;
import com.shipdata.util.ConnectionStringParser.ParsedConnectionString;
import com.shipdata.util.DuckDbTypes;
import com.shipdata.util.SqlGuard;
import com.shipdata.util.SqlIdentifiers;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.shipdata.util.SqlIdentifiers.quote;

/**
 * Snapshot import from Postgres and MySQL.
 *
 * <p>The remote database is attached read-only for the duration of one call, the (optionally
 * filtered) table is copied into the session store, and the attachment is detached on every exit
 * path. No connection outlives the call.
 */
@Slf4j
@Component
public class RemoteDatabaseAdapter implements SourceAdapter<RemoteImportParameters> {

    private final RemoteAttacher attacher;
    private final long largeTableThreshold;

    public RemoteDatabaseAdapter(
            RemoteAttacher attacher,
            @Value("${shipdata.remote.large-table-threshold:10000}") long largeTableThreshold
    ) {
        this.attacher = attacher;
        this.largeTableThreshold = largeTableThreshold;
    }

    @Override
    public SourceType sourceType() {
        return SourceType.REMOTE_DATABASE;
    }

    public long getLargeTableThreshold() {
        return largeTableThreshold;
    }

    @Override
    public ImportResult importData(StagingTable staging, RemoteImportParameters parameters) {
        ParsedConnectionString target = ConnectionStringParser.parse(parameters.getConnectionString());
        String schema = resolveSchema(target, parameters.getSchema());
        String table = SqlIdentifiers.requireRemoteIdentifier(parameters.getTable(), "table");
        String filter = parameters.getFilter() == null || parameters.getFilter().isBlank()
                ? null
                : parameters.getFilter().trim();
        if (filter != null) {
            SqlGuard.requireSafePredicate(filter);
        }

        Connection connection = staging.getConnection();
        String snapshot = staging.newScratch();
        try (RemoteAttachment attachment = attacher.attach(connection, target)) {
            List<String> remoteColumns = remoteColumns(connection, attachment, schema, table, target);
            if (remoteColumns.isEmpty()) {
                throw new SourceNotFoundException(String.format("Table %s.%s not found on %s",
                        schema, table, target.describe()));
            }
            String qualified = attachment.qualify(schema, table);
            if (filter == null) {
                long rows = countRows(connection, qualified, target);
                if (rows > largeTableThreshold) {
                    throw new ValidationException(
                            String.format("Table %s.%s has %d rows, above the %d row limit for an unfiltered import",
                                    schema, table, rows, largeTableThreshold),
                            String.format("Add a filter to narrow the import, e.g. SELECT * FROM %s WHERE %s > '<value>'",
                                    table, remoteColumns.get(0)));
                }
            }
            String select = "SELECT * FROM " + qualified + (filter != null ? " WHERE " + filter : "");
            try (Statement st = connection.createStatement()) {
                st.execute("CREATE TABLE " + quote(snapshot) + " AS " + select);
            } catch (SQLException e) {
                throw remoteFailure(target, "Snapshot of " + schema + "." + table + " failed", e);
            }
        }

        List<String> warnings = new ArrayList<>();
        List<SchemaColumn> schemaColumns;
        StagingTable.FinishedRows finished;
        try {
            List<String> sourceNames = describeNames(connection, snapshot);
            List<String> targetNames = ColumnNames.normalize(sourceNames);
            for (int i = 0; i < sourceNames.size(); i++) {
                if (!sourceNames.get(i).equals(targetNames.get(i))) {
                    warnings.add(String.format("Column '%s' renamed to '%s'", sourceNames.get(i), targetNames.get(i)));
                }
            }
            finished = staging.finishFrom(snapshot, sourceNames, targetNames, null);
            schemaColumns = mapColumns(staging.storedColumns(), warnings);
        } catch (SQLException e) {
            throw new StoreException("Failed to stage snapshot of " + schema + "." + table + ": " + e.getMessage(), e);
        }

        if (finished.skippedRows() > 0) {
            warnings.add(String.format("Skipped %d empty rows", finished.skippedRows()));
        }
        if (filter != null && finished.rowCount() > largeTableThreshold) {
            warnings.add(String.format("Filtered snapshot has %d rows, above the %d row threshold",
                    finished.rowCount(), largeTableThreshold));
        }

        Map<String, String> provenance = new LinkedHashMap<>();
        provenance.put("family", target.getFamily().getAttachType());
        if (target.getHost() != null && !target.getHost().isEmpty()) {
            provenance.put("host", target.getHost());
        }
        provenance.put("schema", schema);
        provenance.put("table", table);
        if (filter != null) {
            provenance.put("filter", filter);
        }

        log.info("Remote import staged: source={}, table={}.{}, rows={}, columns={}",
                target, schema, table, finished.rowCount(), schemaColumns.size());
        return ImportResult.builder()
                .rowCount(finished.rowCount())
                .columns(schemaColumns)
                .warnings(warnings)
                .sourceType(sourceType())
                .provenance(provenance)
                .build();
    }

    /**
     * Base tables of a remote schema with their row counts. Never copies rows.
     *
     * @param connection session connection
     * @param connectionString connection string
     * @param schema remote schema, family default when blank
     * @return tables in name order
     */
    public List<RemoteTable> listTables(Connection connection, String connectionString, String schema) {
        ParsedConnectionString target = ConnectionStringParser.parse(connectionString);
        String resolvedSchema = resolveSchema(target, schema);

        List<RemoteTable> tables = new ArrayList<>();
        try (RemoteAttachment attachment = attacher.attach(connection, target)) {
            List<String> names = new ArrayList<>();
            try (PreparedStatement ps = connection.prepareStatement(
                    "SELECT table_name FROM duckdb_tables() WHERE database_name = ? AND schema_name = ?"
                            + " ORDER BY table_name")) {
                ps.setString(1, attachment.getAlias());
                ps.setString(2, resolvedSchema);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        names.add(rs.getString(1));
                    }
                }
            } catch (SQLException e) {
                throw remoteFailure(target, "Listing tables of schema " + resolvedSchema + " failed", e);
            }

            for (String name : names) {
                try (Statement st = connection.createStatement();
                     ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM " + attachment.qualify(resolvedSchema, name))) {
                    rs.next();
                    long rows = rs.getLong(1);
                    tables.add(new RemoteTable(name, rows, rows > largeTableThreshold));
                } catch (SQLException e) {
                    log.warn("Could not count rows of {}.{} on {}: {}", resolvedSchema, name, target,
                            target.scrub(e.getMessage()));
                    tables.add(new RemoteTable(name, null, false));
                }
            }
        }
        log.info("Listed {} tables in schema {} on {}", tables.size(), resolvedSchema, target);
        return tables;
    }

    private static String resolveSchema(ParsedConnectionString target, String schema) {
        if (schema == null || schema.isBlank()) {
            String fallback = target.defaultSchema();
            if (fallback == null || fallback.isBlank()) {
                throw new ValidationException("No schema given and the connection string names no database",
                        "Pass a schema, or add the database to the connection string path");
            }
            return SqlIdentifiers.requireRemoteIdentifier(fallback, "schema");
        }
        return SqlIdentifiers.requireRemoteIdentifier(schema.trim(), "schema");
    }

    private static List<String> remoteColumns(Connection connection, RemoteAttachment attachment, String schema,
                                              String table, ParsedConnectionString target) {
        List<String> columns = new ArrayList<>();
        try (PreparedStatement ps = connection.prepareStatement(
                "SELECT column_name FROM duckdb_columns() WHERE database_name = ? AND schema_name = ?"
                        + " AND table_name = ? ORDER BY column_index")) {
            ps.setString(1, attachment.getAlias());
            ps.setString(2, schema);
            ps.setString(3, table);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    columns.add(rs.getString(1));
                }
            }
        } catch (SQLException e) {
            throw remoteFailure(target, "Reading columns of " + schema + "." + table + " failed", e);
        }
        return columns;
    }

    private static long countRows(Connection connection, String qualified, ParsedConnectionString target) {
        try (Statement st = connection.createStatement();
             ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM " + qualified)) {
            rs.next();
            return rs.getLong(1);
        } catch (SQLException e) {
            throw remoteFailure(target, "Counting rows failed", e);
        }
    }

    private static List<String> describeNames(Connection connection, String table) throws SQLException {
        List<String> names = new ArrayList<>();
        try (Statement st = connection.createStatement();
             ResultSet rs = st.executeQuery("DESCRIBE " + quote(table))) {
            while (rs.next()) {
                names.add(rs.getString("column_name"));
            }
        }
        return names;
    }

    private static List<SchemaColumn> mapColumns(List<StagingTable.StoredColumn> stored, List<String> warnings) {
        List<SchemaColumn> out = new ArrayList<>(stored.size());
        for (StagingTable.StoredColumn column : stored) {
            ColumnType type = DuckDbTypes.toColumnType(column.storageType());
            List<String> columnWarnings = new ArrayList<>();
            if (DuckDbTypes.isStringFallback(column.storageType(), type)) {
                String warning = String.format("Column '%s' stored as %s; reported as string",
                        column.name(), column.storageType());
                columnWarnings.add(warning);
                warnings.add(warning);
            }
            out.add(SchemaColumn.builder()
                    .name(column.name())
                    .type(type)
                    .storageType(column.storageType())
                    .nullable(column.nullable())
                    .warnings(columnWarnings)
                    .build());
        }
        return out;
    }

    // Errors raised while binding caller input are validation failures; anything else is the remote side.
    private static RuntimeException remoteFailure(ParsedConnectionString target, String context, SQLException e) {
        String reason = target.scrub(e.getMessage());
        log.warn("{} on {}: {}", context, target, reason);
        if (reason != null && (reason.contains("Binder Error") || reason.contains("Parser Error")
                || reason.contains("Conversion Error"))) {
            return new ValidationException(context + ": " + reason,
                    "Check that the filter names existing columns and compares them with matching values");
        }
        return new RemoteConnectionException(target.getFamily().getDisplayName(), context + ": " + reason);
    }
}
