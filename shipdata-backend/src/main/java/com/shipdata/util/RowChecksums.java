package com.shipdata.util;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.sql.SQLException;
import java.util.HexFormat;
import java.util.Map;
import java.util.TreeMap;

/**
 * Deterministic row content hash: key-sorted compact JSON, SHA-256, lowercase hex.
 *
 * <p>The digest depends only on the column name to value mapping, never on the order in which
 * an adapter or query produced the columns.
 */
public final class RowChecksums {

    public static final int HEX_LENGTH = 64;

    private static final ObjectMapper CANONICAL_JSON = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
            .configure(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN, true);

    private RowChecksums() {
    }

    /**
     * Compute the checksum of one row.
     *
     * @param row column name to stored value
     * @return 64 lowercase hex characters
     */
    public static String compute(Map<String, ?> row) {
        TreeMap<String, Object> sorted = new TreeMap<>();
        try {
            for (Map.Entry<String, ?> e : row.entrySet()) {
                sorted.put(e.getKey(), RowValues.toJsonSafe(e.getValue()));
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to read row value for checksum", e);
        }
        try {
            return sha256Hex(CANONICAL_JSON.writeValueAsString(sorted));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize row for checksum", e);
        }
    }

    /**
     * Compare a caller-supplied digest with an actual one, ignoring hex case.
     *
     * @param expected expected digest, may be null
     * @param actual actual digest
     * @return true when equal
     */
    public static boolean matches(String expected, String actual) {
        return expected != null && actual != null && expected.trim().equalsIgnoreCase(actual);
    }

    /**
     * SHA-256 of UTF-8 text as lowercase hex.
     *
     * @param text text
     * @return 64 hex characters
     */
    public static String sha256Hex(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
