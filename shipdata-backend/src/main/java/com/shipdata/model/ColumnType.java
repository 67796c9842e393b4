package com.shipdata.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * The fixed set of column types a DataSource column can be inferred as or overridden to.
 */
public enum ColumnType {
    INTEGER("integer", "INTEGER"),
    BIG_INTEGER("big-integer", "BIGINT"),
    DOUBLE("double", "DOUBLE"),
    DATE("date", "DATE"),
    TIMESTAMP("timestamp", "TIMESTAMP"),
    BOOLEAN("boolean", "BOOLEAN"),
    STRING("string", "VARCHAR");

    // SQL spellings accepted in addition to the wire names.
    private static final Map<String, ColumnType> ALIASES = Map.ofEntries(
            Map.entry("int", INTEGER),
            Map.entry("int4", INTEGER),
            Map.entry("bigint", BIG_INTEGER),
            Map.entry("int8", BIG_INTEGER),
            Map.entry("long", BIG_INTEGER),
            Map.entry("float", DOUBLE),
            Map.entry("float8", DOUBLE),
            Map.entry("bool", BOOLEAN),
            Map.entry("varchar", STRING),
            Map.entry("text", STRING)
    );

    private final String wireName;
    private final String storageType;

    ColumnType(String wireName, String storageType) {
        this.wireName = wireName;
        this.storageType = storageType;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    /**
     * DuckDB type used to store or cast values of this column type.
     *
     * @return DuckDB type name
     */
    public String getStorageType() {
        return storageType;
    }

    /**
     * Resolve a user supplied type name.
     *
     * @param name wire name, enum name or SQL alias, case-insensitive
     * @return matching type, empty when unknown
     */
    public static Optional<ColumnType> lookup(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String v = name.trim().toLowerCase(Locale.ROOT);
        for (ColumnType type : values()) {
            if (type.wireName.equals(v) || type.name().equalsIgnoreCase(v) || type.storageType.equalsIgnoreCase(v)) {
                return Optional.of(type);
            }
        }
        return Optional.ofNullable(ALIASES.get(v));
    }

    @JsonCreator
    public static ColumnType fromWireName(String name) {
        return lookup(name).orElseThrow(() -> new IllegalArgumentException("Unknown column type: " + name));
    }

    public static List<String> wireNames() {
        return Arrays.stream(values()).map(ColumnType::getWireName).toList();
    }

    /**
     * Whether values of this type are whole numbers.
     *
     * @return true for integer and big-integer
     */
    public boolean isIntegral() {
        return this == INTEGER || this == BIG_INTEGER;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
