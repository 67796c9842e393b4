package com.shipdata.inference;

import com.shipdata.model.ColumnType;
import net.jqwik.api.*;
import net.jqwik.api.constraints.*;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.*;

/**
 * Column type resolution over whole columns.
 */
class ColumnTypeAccumulatorPropertyTest {

    /**
     * Property: resolution does not depend on the order values are observed in.
     */
    @Property(tries = 100)
    void resolution_isOrderIndependent(@ForAll("mixedColumns") List<String> values, @ForAll Random random) {
        List<String> shuffled = new ArrayList<>(values);
        Collections.shuffle(shuffled, random);

        InferredColumn original = resolve(values);
        InferredColumn reordered = resolve(shuffled);

        assertThat(reordered.getType()).isEqualTo(original.getType());
        assertThat(reordered.getDateOrder()).isEqualTo(original.getDateOrder());
    }

    /**
     * Property: every value of a resolved non-string column normalizes without error.
     */
    @Property(tries = 100)
    void resolvedType_acceptsEveryValue(@ForAll("mixedColumns") List<String> values) {
        InferredColumn column = resolve(values);

        for (String value : values) {
            assertThatCode(() -> TypeInference.normalize(value, column.getType(), column.getDateOrder()))
                    .doesNotThrowAnyException();
        }
    }

    /**
     * Property: integer columns stay integral, and any double widens them.
     */
    @Property(tries = 100)
    void integers_widenToDouble(@ForAll @Size(min = 1, max = 20) List<@IntRange(min = -100000, max = 100000) Integer> ints,
                                @ForAll @DoubleRange(min = -1000, max = 1000) double extra) {
        List<String> values = new ArrayList<>();
        ints.forEach(i -> values.add(String.valueOf(i)));
        assertThat(resolve(values).getType()).isEqualTo(ColumnType.INTEGER);

        values.add(String.valueOf(extra));
        assertThat(resolve(values).getType()).isEqualTo(ColumnType.DOUBLE);
    }

    @Provide
    Arbitrary<List<String>> mixedColumns() {
        Arbitrary<String> value = Arbitraries.oneOf(
                Arbitraries.integers().between(-1000, 1000).map(String::valueOf),
                Arbitraries.longs().between(3_000_000_000L, 9_000_000_000L).map(String::valueOf),
                Arbitraries.of("1.5", "-0.25", "2e3"),
                Arbitraries.of("2026-01-15", "2026-12-31"),
                Arbitraries.of("2026-01-15 10:30:00"),
                Arbitraries.of("03/04/2026", "12/25/2025", "25/12/2025"),
                Arbitraries.of("true", "False"),
                Arbitraries.of("alpha", "beta"),
                Arbitraries.of("", "  ")
        );
        return value.list().ofMinSize(1).ofMaxSize(15);
    }

    @Test
    void mixedNumbersAndText_fallBackToStringWithWarning() {
        InferredColumn column = resolve(List.of("1", "2", "n/a"));

        assertThat(column.getType()).isEqualTo(ColumnType.STRING);
        assertThat(column.getWarnings()).containsExactly(
                "Column 'c' has mixed value types (integer, string); imported as string");
    }

    @Test
    void integerAndBigInteger_widenToBigInteger() {
        assertThat(resolve(List.of("1", "9000000000")).getType()).isEqualTo(ColumnType.BIG_INTEGER);
    }

    @Test
    void dateAndTimestamp_widenToTimestamp() {
        assertThat(resolve(List.of("2026-01-15", "2026-01-16 08:00:00")).getType()).isEqualTo(ColumnType.TIMESTAMP);
    }

    @Test
    void ambiguousDates_defaultToUsWithWarning() {
        InferredColumn column = resolve(List.of("01/02/2026", "03/04/2026"));

        assertThat(column.getType()).isEqualTo(ColumnType.DATE);
        assertThat(column.getDateOrder()).isEqualTo(DateOrder.MONTH_FIRST);
        assertThat(column.getWarnings()).containsExactly(
                "Column 'c': Date '01/02/2026' could be Jan 02, 2026 (US) or Feb 01, 2026 (EU). Using US format.");
    }

    @Test
    void unambiguousDayFirstValue_switchesColumnToEuOrder() {
        InferredColumn column = resolve(List.of("01/02/2026", "25/12/2025"));

        assertThat(column.getType()).isEqualTo(ColumnType.DATE);
        assertThat(column.getDateOrder()).isEqualTo(DateOrder.DAY_FIRST);
        assertThat(column.getWarnings()).isEmpty();
    }

    @Test
    void conflictingDateOrders_fallBackToString() {
        InferredColumn column = resolve(List.of("12/25/2025", "25/12/2025"));

        assertThat(column.getType()).isEqualTo(ColumnType.STRING);
        assertThat(column.getWarnings()).singleElement().asString().contains("mixes US (MM/DD) and EU (DD/MM)");
    }

    @Test
    void allBlankColumn_isString() {
        InferredColumn column = resolve(List.of("", " "));

        assertThat(column.getType()).isEqualTo(ColumnType.STRING);
        assertThat(column.getWarnings()).isEmpty();
    }

    private static InferredColumn resolve(List<String> values) {
        ColumnTypeAccumulator accumulator = new ColumnTypeAccumulator("c");
        values.forEach(accumulator::observe);
        return accumulator.resolve();
    }
}
