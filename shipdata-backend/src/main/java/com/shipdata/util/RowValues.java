package com.shipdata.util;

import com.shipdata.inference.TypeInference;

import java.sql.Blob;
import java.sql.Clob;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Struct;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.UUID;

/**
 * Converts DuckDB JDBC values into JSON-safe values with one canonical text form per temporal
 * type, so responses and checksums see the same representation whatever path read the row.
 */
public final class RowValues {
    private static final int MAX_NESTED_DEPTH = 3;

    private RowValues() {
    }

    /**
     * Reads a column and converts it.
     *
     * @param rs result set
     * @param columnIndex 1-based column index
     * @return json-safe value
     * @throws SQLException on JDBC errors
     */
    public static Object read(ResultSet rs, int columnIndex) throws SQLException {
        return toJsonSafe(rs.getObject(columnIndex));
    }

    /**
     * Converts a JDBC object.
     *
     * <ul>
     *     <li>dates become {@code yyyy-MM-dd}</li>
     *     <li>timestamps become {@code yyyy-MM-dd HH:mm:ss[.fraction]}</li>
     *     <li>binary values become Base64</li>
     *     <li>lists and structs become lists, up to a fixed nesting depth</li>
     * </ul>
     *
     * @param v value
     * @return json-safe value
     * @throws SQLException on JDBC errors while reading LOB or array contents
     */
    public static Object toJsonSafe(Object v) throws SQLException {
        return convert(v, 0);
    }

    private static Object convert(Object v, int depth) throws SQLException {
        if (v == null) {
            return null;
        }
        if (v instanceof Number || v instanceof Boolean || v instanceof String) {
            return v;
        }
        if (v instanceof java.sql.Timestamp ts) {
            return TypeInference.formatTimestamp(ts.toLocalDateTime());
        }
        if (v instanceof LocalDateTime ldt) {
            return TypeInference.formatTimestamp(ldt);
        }
        if (v instanceof java.sql.Date d) {
            return d.toLocalDate().toString();
        }
        if (v instanceof LocalDate ld) {
            return ld.toString();
        }
        if (v instanceof java.sql.Time t) {
            return t.toLocalTime().toString();
        }
        if (v instanceof LocalTime || v instanceof OffsetDateTime || v instanceof UUID) {
            return v.toString();
        }
        if (v instanceof byte[] bytes) {
            return Base64.getEncoder().encodeToString(bytes);
        }
        if (v instanceof Blob blob) {
            long length = blob.length();
            return length <= 0 ? "" : Base64.getEncoder().encodeToString(blob.getBytes(1, (int) length));
        }
        if (v instanceof Clob clob) {
            long length = clob.length();
            return length <= 0 ? "" : clob.getSubString(1, (int) length);
        }
        if (depth >= MAX_NESTED_DEPTH) {
            return String.valueOf(v);
        }
        if (v instanceof Struct struct) {
            Object[] attrs = struct.getAttributes();
            Object[] safe = attrs != null ? attrs : new Object[0];
            List<Object> out = new ArrayList<>(safe.length);
            for (Object attr : safe) {
                out.add(convert(attr, depth + 1));
            }
            return out;
        }
        if (v instanceof java.sql.Array arr) {
            Object arrayValue = arr.getArray();
            if (arrayValue instanceof Object[] objectArray) {
                List<Object> out = new ArrayList<>(objectArray.length);
                for (Object elem : objectArray) {
                    out.add(convert(elem, depth + 1));
                }
                return out;
            }
            return String.valueOf(arrayValue);
        }
        return String.valueOf(v);
    }
}
