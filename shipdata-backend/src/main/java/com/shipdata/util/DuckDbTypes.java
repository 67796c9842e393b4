package com.shipdata.util;

import com.shipdata.model.ColumnType;

import java.util.Locale;

/**
 * Maps DuckDB column type names, as reported by {@code DESCRIBE}, onto {@link ColumnType}.
 */
public final class DuckDbTypes {

    private DuckDbTypes() {
    }

    /**
     * Maps a DuckDB type name.
     *
     * @param duckdbType type name, e.g. {@code INTEGER}, {@code DECIMAL(10,2)}, {@code VARCHAR[]}
     * @return column type, {@link ColumnType#STRING} for anything without a closer match
     */
    public static ColumnType toColumnType(String duckdbType) {
        if (duckdbType == null) {
            return ColumnType.STRING;
        }
        String normalized = duckdbType.toUpperCase(Locale.ROOT).trim();
        if (normalized.endsWith("]") || normalized.startsWith("STRUCT") || normalized.startsWith("MAP")
                || normalized.startsWith("UNION")) {
            return ColumnType.STRING;
        }
        normalized = normalized.replaceAll("\\(.*\\)", "").trim();

        switch (normalized) {
            case "TINYINT":
            case "SMALLINT":
            case "INTEGER":
            case "UTINYINT":
            case "USMALLINT":
                return ColumnType.INTEGER;
            case "BIGINT":
            case "UINTEGER":
            case "HUGEINT":
            case "UBIGINT":
            case "UHUGEINT":
                return ColumnType.BIG_INTEGER;
            case "FLOAT":
            case "REAL":
            case "DOUBLE":
            case "DECIMAL":
            case "NUMERIC":
                return ColumnType.DOUBLE;
            case "DATE":
                return ColumnType.DATE;
            case "TIMESTAMP":
            case "TIMESTAMP_S":
            case "TIMESTAMP_MS":
            case "TIMESTAMP_NS":
            case "DATETIME":
            case "TIMESTAMP WITH TIME ZONE":
            case "TIMESTAMPTZ":
                return ColumnType.TIMESTAMP;
            case "BOOLEAN":
                return ColumnType.BOOLEAN;
            default:
                return ColumnType.STRING;
        }
    }

    /**
     * Whether a column stored under {@code duckdbType} and reported as {@code type} deserves a
     * "stored as" note, i.e. it was not one of the canonical storage types and had to fall back
     * to string.
     *
     * @param duckdbType storage type name
     * @param type mapped column type
     * @return true when the caller should warn
     */
    public static boolean isStringFallback(String duckdbType, ColumnType type) {
        return type == ColumnType.STRING && duckdbType != null
                && !"VARCHAR".equalsIgnoreCase(duckdbType.trim());
    }
}
