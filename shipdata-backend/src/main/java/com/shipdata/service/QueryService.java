package com.shipdata.service;

import com.shipdata.api.FilterResponse;
import com.shipdata.api.QueryDataResponse;
import com.shipdata.error.SourceNotFoundException;
import com.shipdata.error.ValidationException;
import com.shipdata.model.DataSourceInfo;
import com.shipdata.model.RowData;
import com.shipdata.model.SchemaColumn;
import com.shipdata.util.RowValues;
import com.shipdata.util.SqlGuard;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Read access to the active DataSource: single rows, filtered pages and restricted ad-hoc
 * queries. Every path applies the session's type overrides.
 */
@Slf4j
@Service
public class QueryService {

    private final int maxLimit;
    private final int defaultLimit;

    public QueryService(
            @Value("${shipdata.query.max-limit:1000}") int maxLimit,
            @Value("${shipdata.query.default-limit:100}") int defaultLimit
    ) {
        this.maxLimit = maxLimit;
        this.defaultLimit = defaultLimit;
    }

    /**
     * Fetch one row by its 1-based ordinal.
     *
     * @param session session
     * @param rowNumber ordinal
     * @return row with overrides applied and its checksum
     * @throws SourceNotFoundException when the ordinal is out of range
     */
    public RowData getRow(IngestSession session, long rowNumber) {
        return session.withLock(() -> {
            DataSourceInfo source = session.requireSource();
            requireRowInRange(source, rowNumber);
            RowProjection projection = new RowProjection(source.getColumns(), session.getOverrides());
            try (PreparedStatement ps = session.getConnection().prepareStatement(
                    projection.fromRaw() + " WHERE src._row_num = ?")) {
                ps.setLong(1, rowNumber);
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next()) {
                        throw new SourceNotFoundException("Row " + rowNumber + " not found");
                    }
                    return projection.read(rs);
                }
            }
        });
    }

    /**
     * Rows matching a restricted predicate, in ordinal order.
     *
     * @param session session
     * @param predicate boolean condition over column names; blank means every row
     * @param limit page size; below 1 uses the default, above the cap is clamped
     * @param offset rows to skip, not negative
     * @return page of rows, each with its checksum, plus the total match count
     */
    public FilterResponse getRowsByFilter(IngestSession session, String predicate, int limit, int offset) {
        if (offset < 0) {
            throw new ValidationException("Offset must not be negative, got " + offset, "Use an offset of 0 or more");
        }
        int effectiveLimit = limit < 1 ? defaultLimit : Math.min(limit, maxLimit);
        String where = "";
        if (predicate != null && !predicate.isBlank()) {
            SqlGuard.requireSafePredicate(predicate);
            where = " WHERE (" + predicate + ")";
        }
        String condition = where;

        return session.withLock(() -> {
            DataSourceInfo source = session.requireSource();
            RowProjection projection = new RowProjection(source.getColumns(), session.getOverrides());
            String filtered = "FROM (" + projection.fromRaw() + ") AS t" + condition;
            try {
                long total;
                try (Statement st = session.getConnection().createStatement();
                     ResultSet rs = st.executeQuery("SELECT COUNT(*) " + filtered)) {
                    rs.next();
                    total = rs.getLong(1);
                }
                List<RowData> rows = new ArrayList<>();
                try (PreparedStatement ps = session.getConnection().prepareStatement(
                        "SELECT t.* " + filtered + " ORDER BY t._row_num LIMIT ? OFFSET ?")) {
                    ps.setInt(1, effectiveLimit);
                    ps.setInt(2, offset);
                    try (ResultSet rs = ps.executeQuery()) {
                        while (rs.next()) {
                            rows.add(projection.read(rs));
                        }
                    }
                }
                return FilterResponse.builder()
                        .rows(rows)
                        .totalCount(total)
                        .limit(effectiveLimit)
                        .offset(offset)
                        .build();
            } catch (SQLException e) {
                throw new ValidationException("Filter could not be evaluated: " + e.getMessage(),
                        "Available columns: " + columnNames(source));
            }
        });
    }

    /**
     * Run a single read-only SELECT, typically against the {@code imported_data} view.
     *
     * @param session session
     * @param sql query text
     * @return columns, rows and a truncation flag; at most the configured cap of rows
     * @throws com.shipdata.error.SqlSecurityException before execution for anything but one SELECT
     */
    public QueryDataResponse queryData(IngestSession session, String sql) {
        String statement = SqlGuard.requireReadOnlySelect(sql);
        return session.withLock(() -> {
            DataSourceInfo source = session.requireSource();
            long startTime = System.currentTimeMillis();
            // Newlines keep a trailing line comment from swallowing the closing parenthesis.
            String bounded = "SELECT * FROM (\n" + statement + "\n) AS q LIMIT " + (maxLimit + 1);
            try (Statement st = session.getConnection().createStatement();
                 ResultSet rs = st.executeQuery(bounded)) {
                QueryDataResponse response = new QueryDataResponse();
                processResultSet(rs, response, maxLimit);
                response.getMetadata().setDurationMs(System.currentTimeMillis() - startTime);
                log.info("query_data: session_id={}, rows={}, truncated={}", session.getSessionId(),
                        response.getMetadata().getRowCount(), response.getMetadata().isTruncated());
                return response;
            } catch (SQLException e) {
                throw new ValidationException("Query failed: " + e.getMessage(),
                        "Query the imported_data view; available columns: " + columnNames(source));
            }
        });
    }

    private void processResultSet(ResultSet rs, QueryDataResponse response, int limit) throws SQLException {
        ResultSetMetaData rsmd = rs.getMetaData();
        int columnCount = rsmd.getColumnCount();

        List<QueryDataResponse.ColumnDefinition> columns = new ArrayList<>();
        for (int i = 1; i <= columnCount; i++) {
            QueryDataResponse.ColumnDefinition col = new QueryDataResponse.ColumnDefinition();
            col.setName(rsmd.getColumnName(i));
            col.setType(rsmd.getColumnTypeName(i));
            columns.add(col);
        }

        List<Map<String, Object>> rows = new ArrayList<>();
        int count = 0;
        boolean truncated = false;
        while (rs.next()) {
            if (count >= limit) {
                truncated = true;
                break;
            }
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 1; i <= columnCount; i++) {
                row.put(rsmd.getColumnName(i), RowValues.read(rs, i));
            }
            rows.add(row);
            count++;
        }

        response.setColumns(columns);
        response.setRows(rows);
        QueryDataResponse.Metadata metadata = new QueryDataResponse.Metadata();
        metadata.setRowCount(count);
        metadata.setTruncated(truncated);
        response.setMetadata(metadata);
    }

    static void requireRowInRange(DataSourceInfo source, long rowNumber) {
        if (rowNumber < 1 || rowNumber > source.getRowCount()) {
            throw new SourceNotFoundException(String.format("Row %d is out of range (1..%d)",
                    rowNumber, source.getRowCount()));
        }
    }

    private static String columnNames(DataSourceInfo source) {
        return source.getColumns().stream().map(SchemaColumn::getName).collect(Collectors.joining(", "));
    }

    public int getMaxLimit() {
        return maxLimit;
    }
}
