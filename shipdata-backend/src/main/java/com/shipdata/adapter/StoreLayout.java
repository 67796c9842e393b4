package com.shipdata.adapter;

import com.shipdata.model.ColumnType;
import com.shipdata.model.SchemaColumn;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.shipdata.util.SqlIdentifiers.quote;

/**
 * Table names and SQL fragments describing how a committed DataSource is laid out in the
 * session's DuckDB database.
 */
public final class StoreLayout {

    /**
     * Committed rows: {@code _row_num} followed by the user columns.
     */
    public static final String RAW_TABLE = "imported_data_raw";
    /**
     * User columns with type overrides applied. Ad-hoc queries address this view.
     */
    public static final String VIEW = "imported_data";
    public static final String ROW_NUM = "_row_num";
    public static final String LOAD_SEQ = "_load_seq";

    static final Set<String> RESERVED_COLUMNS = Set.of(ROW_NUM, LOAD_SEQ);

    private StoreLayout() {
    }

    /**
     * Expression reading a column as seen by callers: the stored value, or a {@code TRY_CAST} when
     * an override changes its storage type.
     *
     * @param qualifier table alias, e.g. {@code src}
     * @param column column
     * @param override active override, may be null
     * @return SQL expression without alias
     */
    public static String readExpression(String qualifier, SchemaColumn column, ColumnType override) {
        String ref = qualifier + "." + quote(column.getName());
        if (override == null || override.getStorageType().equalsIgnoreCase(column.getStorageType())) {
            return ref;
        }
        return "TRY_CAST(" + ref + " AS " + override.getStorageType() + ")";
    }

    /**
     * SQL selecting every user column of the raw table, overrides applied, named as the column.
     *
     * @param columns committed columns
     * @param overrides active overrides keyed by column name
     * @return select list, empty for zero columns
     */
    public static List<String> projection(List<SchemaColumn> columns, Map<String, ColumnType> overrides) {
        List<String> out = new ArrayList<>(columns.size());
        for (SchemaColumn column : columns) {
            out.add(readExpression("src", column, overrides.get(column.getName())) + " AS " + quote(column.getName()));
        }
        return out;
    }

    /**
     * Statements (re)creating the {@link #VIEW} over the raw table. A source without user columns
     * has no view.
     *
     * @param columns committed columns
     * @param overrides active overrides
     * @return statements to run in order
     */
    public static List<String> viewStatements(List<SchemaColumn> columns, Map<String, ColumnType> overrides) {
        List<String> statements = new ArrayList<>();
        statements.add("DROP VIEW IF EXISTS " + VIEW);
        if (!columns.isEmpty()) {
            statements.add("CREATE VIEW " + VIEW + " AS SELECT " + String.join(", ", projection(columns, overrides))
                    + " FROM " + RAW_TABLE + " AS src ORDER BY src." + ROW_NUM);
        }
        return statements;
    }
}
