package com.shipdata.adapter;

import com.shipdata.inference.InferredColumn;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.shipdata.util.SqlIdentifiers.quote;

/**
 * Loads canonical text rows into a staging table: a VARCHAR scratch table first, then one
 * {@code CAST} per column into the inferred storage types, then the all-null filter and numbering.
 */
class TextTableLoader implements AutoCloseable {
    private static final int BATCH_SIZE = 1000;

    private final StagingTable staging;
    private final List<InferredColumn> columns;
    private final String scratch;
    private final PreparedStatement insert;
    private long sequence;
    private int pending;

    TextTableLoader(StagingTable staging, List<InferredColumn> columns) throws SQLException {
        this.staging = staging;
        this.columns = columns;
        this.scratch = staging.newScratch();

        List<String> definitions = new ArrayList<>();
        definitions.add(StoreLayout.LOAD_SEQ + " BIGINT");
        for (InferredColumn column : columns) {
            definitions.add(quote(column.getName()) + " VARCHAR");
        }
        try (Statement st = staging.getConnection().createStatement()) {
            st.execute("CREATE TABLE " + quote(scratch) + " (" + String.join(", ", definitions) + ")");
        }
        String placeholders = String.join(", ", Collections.nCopies(columns.size() + 1, "?"));
        this.insert = staging.getConnection().prepareStatement(
                "INSERT INTO " + quote(scratch) + " VALUES (" + placeholders + ")");
    }

    /**
     * Queue one row. Values must already be canonical text for their column type.
     *
     * @param values one entry per column, null for missing values
     * @throws SQLException on store errors
     */
    void append(String[] values) throws SQLException {
        insert.setLong(1, ++sequence);
        for (int i = 0; i < columns.size(); i++) {
            String v = i < values.length ? values[i] : null;
            if (v == null) {
                insert.setNull(i + 2, Types.VARCHAR);
            } else {
                insert.setString(i + 2, v);
            }
        }
        insert.addBatch();
        if (++pending >= BATCH_SIZE) {
            flush();
        }
    }

    private void flush() throws SQLException {
        if (pending > 0) {
            insert.executeBatch();
            pending = 0;
        }
    }

    /**
     * Cast, filter and number the loaded rows into the staging table.
     *
     * @return final and skipped row counts
     * @throws SQLException on store errors, including a value that does not cast
     */
    StagingTable.FinishedRows finish() throws SQLException {
        flush();
        String typed = staging.newScratch();
        List<String> select = new ArrayList<>();
        List<String> names = new ArrayList<>();
        select.add(StoreLayout.LOAD_SEQ);
        for (InferredColumn column : columns) {
            String name = quote(column.getName());
            select.add("CAST(" + name + " AS " + column.getType().getStorageType() + ") AS " + name);
            names.add(column.getName());
        }
        try (Statement st = staging.getConnection().createStatement()) {
            st.execute("CREATE TABLE " + quote(typed) + " AS SELECT " + String.join(", ", select)
                    + " FROM " + quote(scratch));
            st.execute("DROP TABLE " + quote(scratch));
        }
        return staging.finishFrom(typed, names, names, StoreLayout.LOAD_SEQ);
    }

    @Override
    public void close() throws SQLException {
        insert.close();
    }
}
