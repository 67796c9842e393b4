package com.shipdata.util;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Remote database families the store can attach, keyed by connection-string scheme.
 */
public enum DatabaseFamily {
    POSTGRES("postgres", "PostgreSQL", 5432),
    MYSQL("mysql", "MySQL", 3306);

    private static final Map<String, DatabaseFamily> SCHEMES = Map.ofEntries(
            Map.entry("postgresql", POSTGRES),
            Map.entry("postgres", POSTGRES),
            Map.entry("mysql", MYSQL)
    );

    private final String attachType;
    private final String displayName;
    private final int defaultPort;

    DatabaseFamily(String attachType, String displayName, int defaultPort) {
        this.attachType = attachType;
        this.displayName = displayName;
        this.defaultPort = defaultPort;
    }

    /**
     * Resolve a connection-string scheme.
     *
     * @param scheme scheme without {@code ://}, any case
     * @return family, or empty when the scheme is not supported
     */
    public static Optional<DatabaseFamily> fromScheme(String scheme) {
        if (scheme == null) {
            return Optional.empty();
        }
        String v = scheme.trim().toLowerCase(Locale.ROOT);
        return Optional.ofNullable(SCHEMES.get(v));
    }

    public static String supportedSchemes() {
        return "postgresql://, postgres://, mysql://";
    }

    /**
     * DuckDB extension and {@code ATTACH ... (TYPE ...)} name.
     */
    public String getAttachType() {
        return attachType;
    }

    public String getDisplayName() {
        return displayName;
    }

    public int getDefaultPort() {
        return defaultPort;
    }
}
