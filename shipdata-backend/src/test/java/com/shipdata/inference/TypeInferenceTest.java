package com.shipdata.inference;

import com.shipdata.model.ColumnType;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.*;

class TypeInferenceTest {

    @Test
    void classify_recognizesScalarShapes() {
        assertThat(TypeInference.classify("42")).isEqualTo(ColumnType.INTEGER);
        assertThat(TypeInference.classify("-7")).isEqualTo(ColumnType.INTEGER);
        assertThat(TypeInference.classify("3000000000")).isEqualTo(ColumnType.BIG_INTEGER);
        assertThat(TypeInference.classify("3.14")).isEqualTo(ColumnType.DOUBLE);
        assertThat(TypeInference.classify("1e5")).isEqualTo(ColumnType.DOUBLE);
        assertThat(TypeInference.classify("TRUE")).isEqualTo(ColumnType.BOOLEAN);
        assertThat(TypeInference.classify("2026-01-15")).isEqualTo(ColumnType.DATE);
        assertThat(TypeInference.classify("01/15/2026")).isEqualTo(ColumnType.DATE);
        assertThat(TypeInference.classify("2026-01-15 10:30:00")).isEqualTo(ColumnType.TIMESTAMP);
        assertThat(TypeInference.classify("2026-01-15T10:30")).isEqualTo(ColumnType.TIMESTAMP);
        assertThat(TypeInference.classify("hello")).isEqualTo(ColumnType.STRING);
    }

    @Test
    void classify_keepsLossyNumbersAsStrings() {
        assertThat(TypeInference.classify("007")).isEqualTo(ColumnType.STRING);
        assertThat(TypeInference.classify("+5")).isEqualTo(ColumnType.STRING);
        assertThat(TypeInference.classify("123456789012345678901234567890")).isEqualTo(ColumnType.STRING);
    }

    @Test
    void classify_blankIsNoEvidence() {
        assertThat(TypeInference.classify(null)).isNull();
        assertThat(TypeInference.classify("   ")).isNull();
    }

    @Test
    void classify_rejectsImpossibleDates() {
        assertThat(TypeInference.classify("2026-02-30")).isEqualTo(ColumnType.STRING);
        assertThat(TypeInference.classify("13/13/2026")).isEqualTo(ColumnType.STRING);
    }

    @Test
    void datePartEvidence_readsBothOrders() {
        TypeInference.DatePartEvidence evidence = TypeInference.datePartEvidence("03/04/2026");

        assertThat(evidence.monthFirst()).isEqualTo(LocalDate.of(2026, 3, 4));
        assertThat(evidence.dayFirst()).isEqualTo(LocalDate.of(2026, 4, 3));
        assertThat(evidence.isAmbiguous()).isTrue();
    }

    @Test
    void datePartEvidence_unambiguousWhenOneReadingInvalid() {
        TypeInference.DatePartEvidence evidence = TypeInference.datePartEvidence("25/12/2025");

        assertThat(evidence.monthFirst()).isNull();
        assertThat(evidence.dayFirst()).isEqualTo(LocalDate.of(2025, 12, 25));
        assertThat(evidence.isAmbiguous()).isFalse();
    }

    @Test
    void datePartEvidence_sameDayIsNotAmbiguous() {
        assertThat(TypeInference.datePartEvidence("05/05/2026").isAmbiguous()).isFalse();
    }

    @Test
    void datePartEvidence_expandsTwoDigitYears() {
        assertThat(TypeInference.datePartEvidence("12/31/69").monthFirst()).isEqualTo(LocalDate.of(2069, 12, 31));
        assertThat(TypeInference.datePartEvidence("12/31/70").monthFirst()).isEqualTo(LocalDate.of(1970, 12, 31));
    }

    @Test
    void normalize_producesCanonicalText() {
        assertThat(TypeInference.normalize("03/04/2026", ColumnType.DATE, DateOrder.MONTH_FIRST)).isEqualTo("2026-03-04");
        assertThat(TypeInference.normalize("03/04/2026", ColumnType.DATE, DateOrder.DAY_FIRST)).isEqualTo("2026-04-03");
        assertThat(TypeInference.normalize("2026-01-15T10:30", ColumnType.TIMESTAMP, DateOrder.MONTH_FIRST))
                .isEqualTo("2026-01-15 10:30:00");
        assertThat(TypeInference.normalize("2026-01-15", ColumnType.TIMESTAMP, DateOrder.MONTH_FIRST))
                .isEqualTo("2026-01-15 00:00:00");
        assertThat(TypeInference.normalize(" True ", ColumnType.BOOLEAN, DateOrder.MONTH_FIRST)).isEqualTo("true");
        assertThat(TypeInference.normalize("  padded ", ColumnType.STRING, DateOrder.MONTH_FIRST)).isEqualTo("  padded ");
        assertThat(TypeInference.normalize("", ColumnType.INTEGER, DateOrder.MONTH_FIRST)).isNull();
    }

    @Test
    void normalize_rejectsValuesOutsideType() {
        assertThatThrownBy(() -> TypeInference.normalize("soon", ColumnType.DATE, DateOrder.MONTH_FIRST))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void formatTimestamp_keepsFractionOnlyWhenPresent() {
        assertThat(TypeInference.formatTimestamp(LocalDateTime.of(2026, 1, 2, 3, 4, 5)))
                .isEqualTo("2026-01-02 03:04:05");
        assertThat(TypeInference.formatTimestamp(LocalDateTime.of(2026, 1, 2, 3, 4, 5, 120_000_000)))
                .isEqualTo("2026-01-02 03:04:05.12");
        assertThat(TypeInference.formatTimestamp(LocalDateTime.of(2026, 1, 2, 3, 4, 0)))
                .isEqualTo("2026-01-02 03:04:00");
        assertThat(TypeInference.formatTimestamp(LocalDateTime.of(2026, 1, 2, 3, 4, 5, 123_456_000)))
                .isEqualTo("2026-01-02 03:04:05.123456");
    }

    @Test
    void classify_timestampsFinerThanMicrosecondsStayStrings() {
        assertThat(TypeInference.classify("2026-01-15 10:00:00.123456")).isEqualTo(ColumnType.TIMESTAMP);
        assertThat(TypeInference.classify("2026-01-15 10:00:00.123456789")).isEqualTo(ColumnType.STRING);
        assertThat(TypeInference.normalize("2026-01-15 10:00:00.5", ColumnType.TIMESTAMP, DateOrder.MONTH_FIRST))
                .isEqualTo("2026-01-15 10:00:00.5");
    }
}
