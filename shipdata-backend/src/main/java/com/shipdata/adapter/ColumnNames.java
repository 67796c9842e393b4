package com.shipdata.adapter;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Header normalization shared by the file adapters and the remote snapshot.
 */
final class ColumnNames {

    private ColumnNames() {
    }

    /**
     * Trim names, replace blanks with {@code column_<n>}, and make names unique with {@code _1},
     * {@code _2} suffixes. DuckDB compares identifiers case-insensitively, so uniqueness is too.
     *
     * @param rawNames header cells in order, entries may be null
     * @return normalized names, same size
     */
    static List<String> normalize(List<String> rawNames) {
        Set<String> taken = new HashSet<>();
        for (String reserved : StoreLayout.RESERVED_COLUMNS) {
            taken.add(reserved.toLowerCase(Locale.ROOT));
        }
        List<String> out = new ArrayList<>(rawNames.size());
        for (int i = 0; i < rawNames.size(); i++) {
            String raw = rawNames.get(i);
            String name = raw == null ? "" : raw.trim();
            if (name.isEmpty()) {
                name = "column_" + (i + 1);
            }
            String candidate = name;
            int suffix = 1;
            while (!taken.add(candidate.toLowerCase(Locale.ROOT))) {
                candidate = name + "_" + suffix++;
            }
            out.add(candidate);
        }
        return out;
    }

    /**
     * Names for header-less input.
     *
     * @param width number of columns
     * @return {@code column_1 .. column_width}
     */
    static List<String> generated(int width) {
        List<String> out = new ArrayList<>(width);
        for (int i = 1; i <= width; i++) {
            out.add("column_" + i);
        }
        return out;
    }
}
