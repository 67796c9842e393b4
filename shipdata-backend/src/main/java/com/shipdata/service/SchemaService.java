package com.shipdata.service;

import com.shipdata.adapter.StoreLayout;
import com.shipdata.api.OverrideResponse;
import com.shipdata.api.SchemaResponse;
import com.shipdata.error.ValidationException;
import com.shipdata.model.ColumnType;
import com.shipdata.model.DataSourceInfo;
import com.shipdata.model.SchemaColumn;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.shipdata.util.SqlIdentifiers.quote;

/**
 * Schema introspection and type overrides.
 *
 * <p>An override never touches stored rows. It only changes how the {@code imported_data} view
 * and the row readers project a column: {@code TRY_CAST(stored AS type)}.
 */
@Slf4j
@Service
public class SchemaService {

    public SchemaResponse getSchema(IngestSession session) {
        return session.withLock(() -> buildSchema(session.requireSource(), session.getOverrides()));
    }

    /**
     * Reinterpret a column as {@code typeName} at read time.
     *
     * @param session session
     * @param columnName column name, matched exactly first and then ignoring case
     * @param typeName wire name or SQL alias of the new type
     * @return override outcome including how many stored values the cast turns into null
     * @throws ValidationException without a DataSource, for an unknown column or an unknown type
     */
    public OverrideResponse overrideColumnType(IngestSession session, String columnName, String typeName) {
        return session.withLock(() -> {
            DataSourceInfo source = session.requireSource();
            SchemaColumn column = resolveColumn(source, columnName);
            ColumnType type = ColumnType.lookup(typeName).orElseThrow(() -> new ValidationException(
                    "Unknown type '" + typeName + "'",
                    "Valid types: " + String.join(", ", ColumnType.wireNames())));

            long unconvertible = countUnconvertible(session.getConnection(), column, type);
            Map<String, ColumnType> next = new LinkedHashMap<>(session.getOverrides());
            next.put(column.getName(), type);
            applyView(session.getConnection(), source.getColumns(), next);
            session.putOverride(column.getName(), type);

            List<String> warnings = new ArrayList<>();
            if (unconvertible > 0) {
                warnings.add(String.format("%d values in column '%s' cannot be read as %s and will show as null",
                        unconvertible, column.getName(), type.getWireName()));
            }
            log.info("Override applied: session_id={}, column={}, {} -> {}, unconvertible={}",
                    session.getSessionId(), column.getName(), column.getType(), type, unconvertible);
            return OverrideResponse.builder()
                    .column(column.getName())
                    .originalType(column.getType())
                    .newType(type)
                    .unconvertibleValues(unconvertible)
                    .warnings(warnings)
                    .build();
        });
    }

    /**
     * Drop every override of the active DataSource.
     *
     * @param session session
     * @return schema without overrides
     */
    public SchemaResponse clearOverrides(IngestSession session) {
        return session.withLock(() -> {
            DataSourceInfo source = session.requireSource();
            applyView(session.getConnection(), source.getColumns(), Map.of());
            session.clearOverrides();
            return buildSchema(source, session.getOverrides());
        });
    }

    static SchemaColumn resolveColumn(DataSourceInfo source, String columnName) {
        String requested = columnName == null ? "" : columnName.trim();
        for (SchemaColumn column : source.getColumns()) {
            if (column.getName().equals(requested)) {
                return column;
            }
        }
        for (SchemaColumn column : source.getColumns()) {
            if (column.getName().equalsIgnoreCase(requested)) {
                return column;
            }
        }
        throw new ValidationException("Column '" + requested + "' not found",
                "Available columns: " + source.getColumns().stream()
                        .map(SchemaColumn::getName)
                        .collect(Collectors.joining(", ")));
    }

    static void applyView(Connection connection, List<SchemaColumn> columns, Map<String, ColumnType> overrides)
            throws SQLException {
        try (Statement st = connection.createStatement()) {
            for (String sql : StoreLayout.viewStatements(columns, overrides)) {
                st.execute(sql);
            }
        }
    }

    private static long countUnconvertible(Connection connection, SchemaColumn column, ColumnType type)
            throws SQLException {
        String cast = StoreLayout.readExpression("src", column, type);
        if (!cast.startsWith("TRY_CAST")) {
            return 0;
        }
        String sql = "SELECT COUNT(*) FROM " + StoreLayout.RAW_TABLE + " AS src WHERE src."
                + quote(column.getName()) + " IS NOT NULL AND " + cast + " IS NULL";
        try (Statement st = connection.createStatement();
             ResultSet rs = st.executeQuery(sql)) {
            rs.next();
            return rs.getLong(1);
        }
    }

    private static SchemaResponse buildSchema(DataSourceInfo source, Map<String, ColumnType> overrides) {
        List<SchemaColumn> columns = new ArrayList<>(source.getColumns().size());
        for (SchemaColumn column : source.getColumns()) {
            columns.add(column.toBuilder().typeOverride(overrides.get(column.getName())).build());
        }
        Map<String, String> overrideNames = new LinkedHashMap<>();
        overrides.forEach((name, type) -> overrideNames.put(name, type.getWireName()));
        return SchemaResponse.builder()
                .sourceType(source.getSourceType())
                .rowCount(source.getRowCount())
                .columns(columns)
                .overrides(overrideNames)
                .build();
    }
}
