package com.shipdata.service;

import com.shipdata.adapter.StoreLayout;
import com.shipdata.model.ColumnType;
import com.shipdata.model.RowData;
import com.shipdata.model.SchemaColumn;
import com.shipdata.util.RowChecksums;
import com.shipdata.util.RowValues;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.shipdata.util.SqlIdentifiers.quote;

/**
 * Select list over {@code imported_data_raw AS src} that yields, per row, the ordinal, every
 * column as callers see it (overrides applied) and the stored value of every overridden column.
 *
 * <p>Values are read back by position: ordinal, then the visible columns, then the stored copies.
 * Checksums are always computed from stored values.
 */
final class RowProjection {
    private final List<SchemaColumn> columns;
    private final List<Integer> castColumns = new ArrayList<>();
    private final String selectList;

    RowProjection(List<SchemaColumn> columns, Map<String, ColumnType> overrides) {
        this.columns = columns;
        List<String> select = new ArrayList<>();
        select.add("src." + StoreLayout.ROW_NUM + " AS " + StoreLayout.ROW_NUM);
        List<String> storedCopies = new ArrayList<>();
        for (int i = 0; i < columns.size(); i++) {
            SchemaColumn column = columns.get(i);
            String expression = StoreLayout.readExpression("src", column, overrides.get(column.getName()));
            select.add(expression + " AS " + quote(column.getName()));
            if (!expression.startsWith("src.")) {
                castColumns.add(i);
                storedCopies.add("src." + quote(column.getName()) + " AS " + quote("__stored_" + i));
            }
        }
        select.addAll(storedCopies);
        this.selectList = String.join(", ", select);
    }

    /**
     * @return {@code SELECT ... FROM imported_data_raw AS src}
     */
    String fromRaw() {
        return "SELECT " + selectList + " FROM " + StoreLayout.RAW_TABLE + " AS src";
    }

    RowData read(ResultSet rs) throws SQLException {
        long rowNumber = rs.getLong(1);
        Map<String, Object> visible = new LinkedHashMap<>();
        Map<String, Object> stored = new LinkedHashMap<>();
        for (int i = 0; i < columns.size(); i++) {
            Object value = RowValues.read(rs, i + 2);
            visible.put(columns.get(i).getName(), value);
            stored.put(columns.get(i).getName(), value);
        }
        for (int k = 0; k < castColumns.size(); k++) {
            int i = castColumns.get(k);
            stored.put(columns.get(i).getName(), RowValues.read(rs, columns.size() + 2 + k));
        }
        return new RowData(rowNumber, visible, RowChecksums.compute(stored));
    }
}
