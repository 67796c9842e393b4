package com.shipdata.util;

import net.jqwik.api.*;
import net.jqwik.api.constraints.*;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.*;

import static org.assertj.core.api.Assertions.*;

/**
 * Row checksum determinism and format.
 */
class RowChecksumsPropertyTest {

    /**
     * Property: the digest depends on content only, not on column order.
     */
    @Property(tries = 100)
    void checksum_isIndependentOfColumnOrder(@ForAll("rows") Map<String, Object> row, @ForAll Random random) {
        List<String> keys = new ArrayList<>(row.keySet());
        Collections.shuffle(keys, random);
        Map<String, Object> reordered = new LinkedHashMap<>();
        for (String key : keys) {
            reordered.put(key, row.get(key));
        }

        assertThat(RowChecksums.compute(reordered)).isEqualTo(RowChecksums.compute(row));
    }

    /**
     * Property: digests are always 64 lowercase hex characters.
     */
    @Property(tries = 100)
    void checksum_isLowercaseHex(@ForAll("rows") Map<String, Object> row) {
        assertThat(RowChecksums.compute(row))
                .hasSize(RowChecksums.HEX_LENGTH)
                .matches("[0-9a-f]{64}");
    }

    /**
     * Property: changing any single value changes the digest.
     */
    @Property(tries = 100)
    void checksum_changesWhenAValueChanges(@ForAll("rows") Map<String, Object> row) {
        Assume.that(!row.isEmpty());
        String key = row.keySet().iterator().next();
        Map<String, Object> changed = new LinkedHashMap<>(row);
        changed.put(key, String.valueOf(row.get(key)) + "-changed");

        assertThat(RowChecksums.compute(changed)).isNotEqualTo(RowChecksums.compute(row));
    }

    @Provide
    Arbitrary<Map<String, Object>> rows() {
        Arbitrary<Object> value = Arbitraries.oneOf(
                Arbitraries.strings().alpha().ofMaxLength(12).map(s -> (Object) s),
                Arbitraries.integers().map(i -> (Object) i),
                Arbitraries.longs().map(l -> (Object) l),
                Arbitraries.of(true, false).map(b -> (Object) b),
                Arbitraries.just(null)
        );
        return Arbitraries.maps(Arbitraries.strings().alpha().ofMinLength(1).ofMaxLength(8), value)
                .ofMaxSize(10)
                .map(m -> (Map<String, Object>) new LinkedHashMap<>(m));
    }

    @Test
    void checksum_matchesKnownDigest() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("name", "Alice");
        row.put("city", "LA");
        row.put("state", "CA");

        assertThat(RowChecksums.compute(row))
                .isEqualTo("6e07c6fa42e1f6d6298a1e97aa7d9136646222e316c3a3808df3094928d4be0b");
    }

    @Test
    void checksum_serializesNullsAndNumbers() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("b", 2);
        row.put("a", null);

        assertThat(RowChecksums.compute(row))
                .isEqualTo("a7cc49f13c6784d9e52e2f82d4026001396520c2f070a510f56dcf16a9ffa6aa");
    }

    @Test
    void checksum_usesCanonicalTemporalAndDecimalText() {
        Map<String, Object> typed = Map.of("d", LocalDate.of(2026, 1, 15), "n", new BigDecimal("1E+3"));
        Map<String, Object> text = Map.of("d", "2026-01-15", "n", new BigDecimal("1000"));

        assertThat(RowChecksums.compute(typed)).isEqualTo(RowChecksums.compute(text));
    }

    @Test
    void matches_ignoresCaseAndWhitespace() {
        String digest = RowChecksums.sha256Hex("");

        assertThat(digest).isEqualTo("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855");
        assertThat(RowChecksums.matches("  " + digest.toUpperCase(Locale.ROOT) + " ", digest)).isTrue();
        assertThat(RowChecksums.matches(null, digest)).isFalse();
        assertThat(RowChecksums.matches(digest.substring(1), digest)).isFalse();
    }
}
