package com.shipdata.util;

import com.shipdata.error.SqlSecurityException;
import com.shipdata.error.ValidationException;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.select.Select;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Read-only guard for caller-supplied SQL.
 *
 * <p>Two layers: a whole-word verb and file-reading function denylist evaluated outside quoted
 * text and comments, then a JSqlParser AST check that admits exactly one {@link Select}.
 */
public final class SqlGuard {

    static final Set<String> DENIED_WORDS = Set.of(
            "INSERT", "UPDATE", "DELETE", "DROP", "ALTER", "CREATE", "TRUNCATE",
            "ATTACH", "DETACH", "COPY", "PRAGMA", "INSTALL", "LOAD", "EXPORT", "IMPORT",
            "CALL", "SET", "GRANT", "REVOKE", "MERGE"
    );

    // Table functions that read files or other databases; every READ_* function is denied too.
    static final Set<String> DENIED_FUNCTIONS = Set.of(
            "GLOB", "SNIFF_CSV", "PARQUET_SCAN", "PARQUET_METADATA", "PARQUET_SCHEMA",
            "PARQUET_FILE_METADATA", "PARQUET_KV_METADATA", "DELTA_SCAN", "ICEBERG_SCAN",
            "SQLITE_SCAN", "POSTGRES_SCAN", "POSTGRES_QUERY", "MYSQL_SCAN", "MYSQL_QUERY"
    );

    private SqlGuard() {
    }

    /**
     * Validate an ad-hoc query.
     *
     * @param sql query text
     * @return the statement with any trailing semicolon removed, ready to execute
     * @throws SqlSecurityException if the text is anything but a single read-only SELECT
     */
    public static String requireReadOnlySelect(String sql) {
        if (sql == null || sql.isBlank()) {
            throw new SqlSecurityException("Query is empty");
        }
        String statement = stripTrailingSemicolons(sql);
        Scan scan = scan(statement);
        if (scan.unterminated()) {
            throw new SqlSecurityException("Query contains unterminated quoted text");
        }
        if (scan.semicolons() > 0) {
            throw new SqlSecurityException("Only a single statement is allowed");
        }
        for (String word : scan.words()) {
            if (DENIED_WORDS.contains(word)) {
                throw new SqlSecurityException("Statement contains a disallowed keyword: " + word);
            }
        }
        requireNoExternalReads(scan);

        Statement parsed;
        try {
            parsed = CCJSqlParserUtil.parse(statement);
        } catch (JSQLParserException e) {
            throw new SqlSecurityException("Query could not be parsed as a single SELECT statement");
        }
        if (!(parsed instanceof Select)) {
            throw new SqlSecurityException("Only SELECT statements are allowed, got "
                    + parsed.getClass().getSimpleName());
        }
        return statement;
    }

    /**
     * Validate a row filter predicate, the text that follows {@code WHERE}.
     *
     * @param predicate boolean condition
     * @throws SqlSecurityException for statement separators, sub-queries or denied verbs
     * @throws ValidationException when the text is not a boolean condition
     */
    public static void requireSafePredicate(String predicate) {
        Scan scan = scan(predicate);
        if (scan.unterminated()) {
            throw new ValidationException("Filter contains unterminated quoted text",
                    "Close every quote, e.g. city = 'Los Angeles'");
        }
        if (scan.semicolons() > 0) {
            throw new SqlSecurityException("Filter must not contain ';'");
        }
        for (String word : scan.words()) {
            if ("SELECT".equals(word)) {
                throw new SqlSecurityException("Filter must not contain a sub-query");
            }
            if (DENIED_WORDS.contains(word)) {
                throw new SqlSecurityException("Filter contains a disallowed keyword: " + word);
            }
        }
        requireNoExternalReads(scan);
        try {
            CCJSqlParserUtil.parseCondExpression(predicate, false);
        } catch (JSQLParserException e) {
            throw new ValidationException("Filter is not a valid condition: " + predicate,
                    "Write a boolean condition over column names, e.g. state = 'CA' AND amount > 100");
        }
    }

    private static void requireNoExternalReads(Scan scan) {
        for (String call : scan.calls()) {
            if (call.startsWith("READ_") || DENIED_FUNCTIONS.contains(call)) {
                throw new SqlSecurityException("Function " + call.toLowerCase(Locale.ROOT)
                        + " reads outside the imported data and is not allowed");
            }
        }
    }

    private static String stripTrailingSemicolons(String sql) {
        String s = sql.strip();
        while (s.endsWith(";")) {
            s = s.substring(0, s.length() - 1).strip();
        }
        return s;
    }

    /**
     * Upper-cased words, function calls and semicolons found in code, skipping string literals,
     * quoted identifiers and comments. A call is a word followed by an opening parenthesis.
     */
    static Scan scan(String sql) {
        List<String> words = new ArrayList<>();
        List<String> calls = new ArrayList<>();
        int semicolons = 0;
        int i = 0;
        int n = sql.length();
        while (i < n) {
            char c = sql.charAt(i);
            if (c == '\'' || c == '"') {
                int end = closingQuote(sql, i + 1, c);
                if (end == -1) {
                    return new Scan(words, calls, semicolons, true);
                }
                i = end + 1;
            } else if (c == '-' && i + 1 < n && sql.charAt(i + 1) == '-') {
                int end = sql.indexOf('\n', i);
                i = end == -1 ? n : end + 1;
            } else if (c == '/' && i + 1 < n && sql.charAt(i + 1) == '*') {
                int end = sql.indexOf("*/", i + 2);
                if (end == -1) {
                    return new Scan(words, calls, semicolons, true);
                }
                i = end + 2;
            } else if (c == ';') {
                semicolons++;
                i++;
            } else if (Character.isLetter(c) || c == '_') {
                int start = i;
                while (i < n && (Character.isLetterOrDigit(sql.charAt(i)) || sql.charAt(i) == '_' || sql.charAt(i) == '$')) {
                    i++;
                }
                String word = sql.substring(start, i).toUpperCase(Locale.ROOT);
                words.add(word);
                int next = i;
                while (next < n && Character.isWhitespace(sql.charAt(next))) {
                    next++;
                }
                if (next < n && sql.charAt(next) == '(') {
                    calls.add(word);
                }
            } else {
                i++;
            }
        }
        return new Scan(words, calls, semicolons, false);
    }

    // Doubled quotes escape; returns the index of the closing quote or -1.
    private static int closingQuote(String sql, int from, char quote) {
        int i = from;
        while (i < sql.length()) {
            if (sql.charAt(i) == quote) {
                if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i;
            }
            i++;
        }
        return -1;
    }

    record Scan(List<String> words, List<String> calls, int semicolons, boolean unterminated) {
    }
}
