package com.shipdata.util;

import com.shipdata.error.ValidationException;

import java.util.regex.Pattern;

/**
 * Quoting helpers for identifiers and literals that end up inside DuckDB SQL text.
 */
public final class SqlIdentifiers {

    private static final Pattern REMOTE_IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_$\\-]{0,127}");

    private SqlIdentifiers() {
    }

    /**
     * Double-quote an identifier, doubling embedded quotes.
     *
     * @param identifier identifier
     * @return quoted identifier
     */
    public static String quote(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    /**
     * Single-quote a string literal, doubling embedded quotes.
     *
     * @param value value
     * @return quoted literal
     */
    public static String literal(String value) {
        return "'" + value.replace("'", "''") + "'";
    }

    /**
     * Validate a remote schema or table name supplied by the caller.
     *
     * @param identifier identifier
     * @param kind what the identifier names, used in the message
     * @return the identifier
     * @throws ValidationException when the name is blank or contains unexpected characters
     */
    public static String requireRemoteIdentifier(String identifier, String kind) {
        if (identifier == null || identifier.isBlank()) {
            throw new ValidationException("A " + kind + " name is required",
                    "Call list_tables to see the available " + kind + " names");
        }
        if (!REMOTE_IDENTIFIER.matcher(identifier).matches()) {
            throw new ValidationException("Invalid " + kind + " name '" + identifier + "'",
                    "Use letters, digits, '_', '$' or '-', starting with a letter or '_'");
        }
        return identifier;
    }
}
